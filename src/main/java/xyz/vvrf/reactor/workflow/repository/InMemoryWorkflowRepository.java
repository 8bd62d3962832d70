package xyz.vvrf.reactor.workflow.repository;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.core.WorkflowEdge;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 内存实现，所有操作在同一把锁内完成。节点和边按 id 升序返回。
 */
@Slf4j
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<Long, Workflow> workflows = new HashMap<>();
    private final Map<Long, WorkflowNode> nodes = new TreeMap<>();
    private final Map<Long, WorkflowEdge> edges = new TreeMap<>();
    private final Map<Long, Long> edgeWorkflow = new HashMap<>();

    @Override
    public synchronized Workflow saveWorkflow(Workflow workflow) {
        Objects.requireNonNull(workflow, "工作流不能为空");
        workflows.put(workflow.getId(), workflow);
        log.debug("保存工作流 {}", workflow.getId());
        return workflow;
    }

    @Override
    public synchronized Optional<Workflow> findWorkflow(long workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public synchronized boolean deleteWorkflow(long workflowId) {
        if (workflows.remove(workflowId) == null) {
            return false;
        }
        List<Long> nodeIds = nodes.values().stream()
                .filter(node -> node.getWorkflowId() == workflowId)
                .map(WorkflowNode::getId)
                .collect(Collectors.toList());
        nodeIds.forEach(this::removeNodeAndEdges);
        edgeWorkflow.entrySet().removeIf(entry -> {
            if (entry.getValue() == workflowId) {
                edges.remove(entry.getKey());
                return true;
            }
            return false;
        });
        log.debug("删除工作流 {}，级联删除 {} 个节点", workflowId, nodeIds.size());
        return true;
    }

    @Override
    public synchronized WorkflowNode saveNode(WorkflowNode node) {
        Objects.requireNonNull(node, "节点不能为空");
        if (!workflows.containsKey(node.getWorkflowId())) {
            throw new IllegalArgumentException("workflow " + node.getWorkflowId() + " does not exist");
        }
        WorkflowNode existing = nodes.get(node.getId());
        if (existing != null && existing.getWorkflowId() != node.getWorkflowId()) {
            throw new IllegalArgumentException("node " + node.getId() + " belongs to workflow " + existing.getWorkflowId());
        }
        nodes.put(node.getId(), node);
        return node;
    }

    @Override
    public synchronized Optional<WorkflowNode> findNode(long nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    @Override
    public synchronized boolean deleteNode(long nodeId) {
        if (!nodes.containsKey(nodeId)) {
            return false;
        }
        removeNodeAndEdges(nodeId);
        return true;
    }

    private void removeNodeAndEdges(long nodeId) {
        nodes.remove(nodeId);
        Iterator<Map.Entry<Long, WorkflowEdge>> iterator = edges.entrySet().iterator();
        while (iterator.hasNext()) {
            WorkflowEdge edge = iterator.next().getValue();
            if (edge.getParentId() == nodeId || edge.getChildId() == nodeId) {
                iterator.remove();
                edgeWorkflow.remove(edge.getId());
            }
        }
    }

    @Override
    public synchronized WorkflowEdge saveEdge(long workflowId, WorkflowEdge edge) {
        Objects.requireNonNull(edge, "边不能为空");
        if (edge.getParentId() == edge.getChildId()) {
            throw new IllegalArgumentException("edge " + edge.getId() + " is a self loop on node " + edge.getParentId());
        }
        requireNodeInWorkflow(edge.getParentId(), workflowId);
        requireNodeInWorkflow(edge.getChildId(), workflowId);
        for (WorkflowEdge existing : edges.values()) {
            if (existing.getId() != edge.getId()
                    && existing.getParentId() == edge.getParentId()
                    && existing.getChildId() == edge.getChildId()) {
                throw new IllegalArgumentException(String.format("edge %d -> %d already exists (edge %d)",
                        edge.getParentId(), edge.getChildId(), existing.getId()));
            }
        }
        edges.put(edge.getId(), edge);
        edgeWorkflow.put(edge.getId(), workflowId);
        return edge;
    }

    private void requireNodeInWorkflow(long nodeId, long workflowId) {
        WorkflowNode node = nodes.get(nodeId);
        if (node == null || node.getWorkflowId() != workflowId) {
            throw new IllegalArgumentException("node " + nodeId + " does not exist in workflow " + workflowId);
        }
    }

    @Override
    public synchronized boolean deleteEdge(long edgeId) {
        edgeWorkflow.remove(edgeId);
        return edges.remove(edgeId) != null;
    }

    @Override
    public synchronized List<WorkflowNode> listNodes(long workflowId) {
        return nodes.values().stream()
                .filter(node -> node.getWorkflowId() == workflowId)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<WorkflowEdge> listEdges(long workflowId) {
        return edges.values().stream()
                .filter(edge -> Objects.equals(edgeWorkflow.get(edge.getId()), workflowId))
                .collect(Collectors.toList());
    }
}
