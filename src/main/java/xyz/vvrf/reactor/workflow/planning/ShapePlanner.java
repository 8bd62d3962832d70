package xyz.vvrf.reactor.workflow.planning;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.*;
import xyz.vvrf.reactor.workflow.registry.NodeServiceRegistry;
import xyz.vvrf.reactor.workflow.util.Shapes;
import xyz.vvrf.reactor.workflow.validation.DagValidator;

import java.util.*;

/**
 * 形状规划：按拓扑顺序为每个节点推算输入/输出形状，不做任何真实计算。
 * <ul>
 *     <li>输入形状：父节点输出形状的并集合并（入口节点使用 starting_inputs 的形状）</li>
 *     <li>输出形状：声明的 structured_output 非空时优先，否则由节点实现的 plan() 给出</li>
 * </ul>
 */
@Slf4j
public class ShapePlanner {

    private final NodeServiceRegistry registry;
    private final DagValidator validator;

    public ShapePlanner(NodeServiceRegistry registry, DagValidator validator) {
        this.registry = Objects.requireNonNull(registry, "NodeServiceRegistry 不能为空");
        this.validator = Objects.requireNonNull(validator, "DagValidator 不能为空");
    }

    /**
     * @throws IllegalStateException 图未通过结构校验
     */
    public List<PlannedNode> plan(Collection<WorkflowNode> nodes,
                                  Collection<WorkflowEdge> edges,
                                  Map<String, Object> startingInputs) {
        WorkflowGraph graph = WorkflowGraph.of(nodes, edges);
        DagValidationResult validation = validator.validate(graph);
        if (!validation.isValid()) {
            throw new IllegalStateException("无法规划未通过校验的工作流图: " + validation.getErrors());
        }

        Map<String, Object> startingShape = Shapes.describe(startingInputs == null ? Collections.emptyMap() : startingInputs);
        Map<Long, Map<String, Object>> outputShapes = new HashMap<>();
        List<PlannedNode> planned = new ArrayList<>();

        for (Long nodeId : validation.getTopoOrder()) {
            WorkflowNode node = graph.getNode(nodeId);
            List<Long> parents = graph.getParents(nodeId);

            Map<String, Object> inputShape;
            List<String> notes;
            if (parents.isEmpty()) {
                inputShape = new LinkedHashMap<>(startingShape);
                notes = new ArrayList<>();
            } else {
                UnionMerger.Result merged = UnionMerger.merge(UnionMerger.inTopoOrder(parents, validation.getTopoOrder(), outputShapes));
                inputShape = merged.getMerged();
                notes = new ArrayList<>(merged.getNotes());
            }

            Map<String, Object> outputShape = planOutput(node, inputShape);
            outputShapes.put(nodeId, outputShape);
            planned.add(new PlannedNode(nodeId, node.getNodeType(), inputShape, outputShape, notes));
        }
        log.debug("Planned {} node(s), order: {}", planned.size(), validation.getTopoOrder());
        return planned;
    }

    private Map<String, Object> planOutput(WorkflowNode node, Map<String, Object> inputShape) {
        Map<String, Object> declared = Shapes.fromStructuredOutput(node.getStructuredOutput());
        if (!declared.isEmpty()) {
            return declared;
        }
        NodeService service = registry.requireService(node.getNodeType());
        Map<String, Object> planned = service.plan(node.getMetadata(), inputShape, node.getStructuredOutput());
        return planned == null ? new LinkedHashMap<>() : new LinkedHashMap<>(planned);
    }
}
