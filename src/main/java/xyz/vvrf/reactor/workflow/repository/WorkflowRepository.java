package xyz.vvrf.reactor.workflow.repository;

import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.core.WorkflowDefinition;
import xyz.vvrf.reactor.workflow.core.WorkflowEdge;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.execution.SubWorkflowResolver;

import java.util.List;
import java.util.Optional;

/**
 * 工作流、节点和边的读写模型。
 * 边没有独立的生命周期：删除节点时级联删除与其相连的边。
 */
public interface WorkflowRepository extends SubWorkflowResolver {

    Workflow saveWorkflow(Workflow workflow);

    Optional<Workflow> findWorkflow(long workflowId);

    /**
     * 删除工作流及其全部节点和边。
     */
    boolean deleteWorkflow(long workflowId);

    /**
     * @throws IllegalArgumentException 节点所属的工作流不存在
     */
    WorkflowNode saveNode(WorkflowNode node);

    Optional<WorkflowNode> findNode(long nodeId);

    boolean deleteNode(long nodeId);

    /**
     * @throws IllegalArgumentException 自环、重复的 (parent, child) 或端点不属于该工作流
     */
    WorkflowEdge saveEdge(long workflowId, WorkflowEdge edge);

    boolean deleteEdge(long edgeId);

    List<WorkflowNode> listNodes(long workflowId);

    List<WorkflowEdge> listEdges(long workflowId);

    @Override
    default Optional<WorkflowDefinition> findDefinition(long workflowId) {
        return findWorkflow(workflowId)
                .map(workflow -> WorkflowDefinition.of(workflow, listNodes(workflowId), listEdges(workflowId)));
    }
}
