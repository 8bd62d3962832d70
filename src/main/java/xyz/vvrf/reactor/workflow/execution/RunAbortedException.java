package xyz.vvrf.reactor.workflow.execution;

import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.exception.WorkflowException;

/**
 * on_error 为 fail 的节点失败后抛出，停止调度剩余节点。
 */
public class RunAbortedException extends WorkflowException {

    private final WorkflowNode failedNode;

    public RunAbortedException(WorkflowNode failedNode, Throwable cause) {
        super("node " + failedNode.getId() + " (" + failedNode.getNodeType() + ") failed: " + cause.getMessage(), cause);
        this.failedNode = failedNode;
    }

    public WorkflowNode getFailedNode() {
        return failedNode;
    }
}
