package xyz.vvrf.reactor.workflow.validation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import xyz.vvrf.reactor.workflow.core.*;
import xyz.vvrf.reactor.workflow.util.GraphUtils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 工作流 DAG 的结构校验。所有问题都收集为错误或警告，从不抛出异常，
 * 以便界面能渲染只违反部分规则的图。
 * <p>
 * 规则依次为：边引用合法性（未知节点、自环、重复边）、环检测、多父节点、
 * return 节点位置、分支标签，最后是触发器检查（只有给出 {@link Workflow} 时）。
 * 孤立节点是合法的额外入口。
 */
@Slf4j
public class DagValidator {

    public static final String NO_TRIGGER_WARNING = "no trigger configured";

    public DagValidationResult validate(Collection<WorkflowNode> nodes, Collection<WorkflowEdge> edges) {
        return validate(WorkflowGraph.of(nodes, edges));
    }

    /**
     * 结构校验加上触发器检查。
     */
    public DagValidationResult validate(Workflow workflow, Collection<WorkflowNode> nodes, Collection<WorkflowEdge> edges) {
        DagValidationResult structural = validate(nodes, edges);
        if (workflow == null) {
            return structural;
        }
        List<String> warnings = new ArrayList<>(structural.getWarnings());
        warnings.addAll(validateTriggers(workflow));
        return new DagValidationResult(structural.getErrors(), warnings, structural.getTopoOrder());
    }

    public DagValidationResult validate(WorkflowGraph graph) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        checkEdgeReferences(graph, errors);

        // 1. 环检测
        GraphUtils.TopologicalSort sort = GraphUtils.topologicalSort(graph);
        List<Long> topoOrder = Collections.emptyList();
        if (sort.isComplete()) {
            topoOrder = sort.getOrder();
        } else {
            List<Long> cycle = GraphUtils.findCyclePath(graph, sort.getRemaining());
            errors.add("cycle detected: " + cycle.stream().map(String::valueOf).collect(Collectors.joining(" -> ")));
        }

        for (WorkflowNode node : graph.getNodes()) {
            // 2. 只有 merge 节点允许多个父节点
            int inDegree = graph.inDegree(node.getId());
            if (inDegree > 1 && node.getNodeType() != NodeType.MERGE) {
                errors.add(String.format("node %d (%s) has %d parents but is not a merge node",
                        node.getId(), node.getNodeType(), inDegree));
            }
            // 3. return 节点位置
            if (node.getNodeType() == NodeType.RETURN) {
                checkReturnPlacement(graph, node, errors);
            }
            // 4. 分支标签
            checkBranchLabels(graph, node, errors, warnings);
        }

        if (!errors.isEmpty()) {
            topoOrder = Collections.emptyList();
            log.debug("DAG validation found {} error(s): {}", errors.size(), errors);
        }
        return new DagValidationResult(errors, warnings, topoOrder);
    }

    private void checkEdgeReferences(WorkflowGraph graph, List<String> errors) {
        for (WorkflowEdge edge : graph.getEdges()) {
            if (edge.getParentId() == edge.getChildId()) {
                errors.add(String.format("edge %d is a self loop on node %d", edge.getId(), edge.getParentId()));
            }
        }
        for (WorkflowEdge edge : graph.getDanglingEdges()) {
            long unknown = graph.contains(edge.getParentId()) ? edge.getChildId() : edge.getParentId();
            errors.add(String.format("edge %d references unknown node %d", edge.getId(), unknown));
        }
        for (WorkflowEdge edge : graph.getDuplicateEdges()) {
            errors.add(String.format("edge %d duplicates %d -> %d", edge.getId(), edge.getParentId(), edge.getChildId()));
        }
    }

    private void checkReturnPlacement(WorkflowGraph graph, WorkflowNode node, List<String> errors) {
        long id = node.getId();
        if (graph.inDegree(id) == 0) {
            errors.add(String.format("return node %d has no incoming edges", id));
        }
        if (graph.outDegree(id) > 0) {
            errors.add(String.format("return node %d has outgoing edges", id));
        }
        graph.getAncestors(id).stream()
                .sorted()
                .filter(ancestorId -> graph.getNode(ancestorId).getNodeType() == NodeType.FOR_EACH)
                .findFirst()
                .ifPresent(forEachId -> errors.add(String.format(
                        "return nested under for_each: return node %d has for_each ancestor %d", id, forEachId)));
    }

    private void checkBranchLabels(WorkflowGraph graph, WorkflowNode node, List<String> errors, List<String> warnings) {
        List<WorkflowEdge> outgoing = graph.getOutgoingEdges(node.getId());
        if (node.getNodeType() == NodeType.IF_ELSE) {
            int trueEdges = 0;
            int falseEdges = 0;
            for (WorkflowEdge edge : outgoing) {
                String label = edge.getBranchLabel();
                if (WorkflowEdge.LABEL_TRUE.equals(label)) {
                    trueEdges++;
                } else if (WorkflowEdge.LABEL_FALSE.equals(label)) {
                    falseEdges++;
                } else {
                    errors.add(String.format("if_else node %d has edge to %d with branch_label %s; expected 'true' or 'false'",
                            node.getId(), edge.getChildId(), label == null ? "none" : "'" + label + "'"));
                }
            }
            if (outgoing.isEmpty()) {
                warnings.add(String.format("if_else node %d has no outgoing edges", node.getId()));
            } else if (trueEdges != 1 || falseEdges != 1) {
                warnings.add(String.format("if_else node %d should have exactly one 'true' and one 'false' edge (true: %d, false: %d)",
                        node.getId(), trueEdges, falseEdges));
            }
            return;
        }
        for (WorkflowEdge edge : outgoing) {
            if (edge.hasBranchLabel()) {
                errors.add(String.format("node %d (%s) has edge to %d with branch_label '%s' but only if_else nodes can have branch labels",
                        node.getId(), node.getNodeType(), edge.getChildId(), edge.getBranchLabel()));
            }
        }
    }

    /**
     * 触发器检查，只产生警告。
     */
    public List<String> validateTriggers(Workflow workflow) {
        List<String> warnings = new ArrayList<>();
        if (workflow.hasCronSchedule() && !CronExpression.isValidExpression(toSpringCron(workflow.getCronSchedule()))) {
            warnings.add("invalid cron schedule: " + workflow.getCronSchedule());
        }
        if (!workflow.hasTrigger()) {
            warnings.add(NO_TRIGGER_WARNING);
        }
        return warnings;
    }

    /**
     * 标准五段 cron（分 时 日 月 周）补上秒字段后交给 Spring 校验，六段表达式原样使用。
     */
    static String toSpringCron(String cron) {
        String trimmed = cron.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }
}
