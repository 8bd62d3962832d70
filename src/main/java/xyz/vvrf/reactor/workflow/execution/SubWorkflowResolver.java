package xyz.vvrf.reactor.workflow.execution;

import xyz.vvrf.reactor.workflow.core.WorkflowDefinition;

import java.util.Optional;

/**
 * 为 workflow 类型节点解析子工作流的节点和边。
 */
@FunctionalInterface
public interface SubWorkflowResolver {

    Optional<WorkflowDefinition> findDefinition(long workflowId);

    /**
     * 不支持子工作流的解析器。
     */
    static SubWorkflowResolver none() {
        return workflowId -> Optional.empty();
    }
}
