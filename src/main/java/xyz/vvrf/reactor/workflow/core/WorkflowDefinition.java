package xyz.vvrf.reactor.workflow.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个工作流的完整读模型：工作流本身（可选）及其节点和边。
 */
public final class WorkflowDefinition {

    private final long workflowId;
    private final Workflow workflow;
    private final List<WorkflowNode> nodes;
    private final List<WorkflowEdge> edges;

    private WorkflowDefinition(long workflowId, Workflow workflow,
                               Collection<WorkflowNode> nodes, Collection<WorkflowEdge> edges) {
        this.workflowId = workflowId;
        this.workflow = workflow;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(nodes, "节点列表不能为空")));
        this.edges = edges == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(edges));
    }

    public static WorkflowDefinition of(Workflow workflow, Collection<WorkflowNode> nodes, Collection<WorkflowEdge> edges) {
        Objects.requireNonNull(workflow, "工作流不能为空");
        return new WorkflowDefinition(workflow.getId(), workflow, nodes, edges);
    }

    /**
     * 没有工作流记录时使用，工作流 id 取第一个节点的 workflowId（没有节点时为 0）。
     */
    public static WorkflowDefinition of(Collection<WorkflowNode> nodes, Collection<WorkflowEdge> edges) {
        long workflowId = nodes.isEmpty() ? 0L : nodes.iterator().next().getWorkflowId();
        return new WorkflowDefinition(workflowId, null, nodes, edges);
    }

    public long getWorkflowId() {
        return workflowId;
    }

    public Optional<Workflow> getWorkflow() {
        return Optional.ofNullable(workflow);
    }

    public List<WorkflowNode> getNodes() {
        return nodes;
    }

    public List<WorkflowEdge> getEdges() {
        return edges;
    }

    public WorkflowGraph toGraph() {
        return WorkflowGraph.of(nodes, edges);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{workflowId=" + workflowId + ", nodes=" + nodes.size() + ", edges=" + edges.size() + '}';
    }
}
