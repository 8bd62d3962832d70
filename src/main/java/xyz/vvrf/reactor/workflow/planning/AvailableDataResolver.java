package xyz.vvrf.reactor.workflow.planning;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.*;
import xyz.vvrf.reactor.workflow.util.GraphUtils;

import java.util.*;

/**
 * 可用数据解析：某个节点能引用的数据 = 其全部传递祖先输出的并集合并（按拓扑下标，后者覆盖前者）。
 * 执行器用真实输出调用 {@link #resolve}，配置界面用规划出的形状调用 {@link #availableDataMap}。
 */
@Slf4j
public class AvailableDataResolver {

    private final ShapePlanner planner;

    public AvailableDataResolver(ShapePlanner planner) {
        this.planner = Objects.requireNonNull(planner, "ShapePlanner 不能为空");
    }

    /**
     * 合并目标节点所有已有输出的祖先。没有输出（未执行、被跳过）的祖先被忽略。
     */
    public UnionMerger.Result resolve(long targetNodeId, WorkflowGraph graph, Map<Long, Map<String, Object>> outputsByNode) {
        return resolve(targetNodeId, graph, GraphUtils.topologicalSort(graph).getOrder(), outputsByNode);
    }

    /**
     * 已知拓扑顺序时的版本，执行器在每个节点前调用。
     */
    public UnionMerger.Result resolve(long targetNodeId, WorkflowGraph graph, List<Long> topoOrder,
                                      Map<Long, Map<String, Object>> outputsByNode) {
        Set<Long> ancestors = graph.getAncestors(targetNodeId);
        return UnionMerger.merge(UnionMerger.inTopoOrder(ancestors, topoOrder, outputsByNode));
    }

    /**
     * 每个节点可引用字段的预览：祖先规划输出形状的并集，入口节点为空对象。
     * 结果按拓扑顺序排列。
     *
     * @throws IllegalStateException 图未通过结构校验
     */
    public Map<Long, Map<String, Object>> availableDataMap(Collection<WorkflowNode> nodes,
                                                          Collection<WorkflowEdge> edges,
                                                          Map<String, Object> startingInputs) {
        List<PlannedNode> planned = planner.plan(nodes, edges, startingInputs);
        WorkflowGraph graph = WorkflowGraph.of(nodes, edges);

        Map<Long, Map<String, Object>> shapes = new LinkedHashMap<>();
        List<Long> order = new ArrayList<>();
        for (PlannedNode node : planned) {
            shapes.put(node.getNodeId(), node.getOutputShape());
            order.add(node.getNodeId());
        }

        Map<Long, Map<String, Object>> available = new LinkedHashMap<>();
        for (Long nodeId : order) {
            UnionMerger.Result merged = UnionMerger.merge(
                    UnionMerger.inTopoOrder(graph.getAncestors(nodeId), order, shapes));
            if (!merged.getNotes().isEmpty()) {
                log.debug("Available data for node {} has conflicts: {}", nodeId, merged.getNotes());
            }
            available.put(nodeId, merged.getMerged());
        }
        return available;
    }
}
