package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.NodeType;

/**
 * 节点 execute() 失败，是否中断运行由节点的 on_error 策略决定。
 * 叶子客户端在还不知道节点 id 时抛出的实例 nodeId 为 null。
 */
public class NodeExecutionException extends WorkflowException {

    private final Long nodeId;
    private final NodeType nodeType;

    public NodeExecutionException(String message) {
        this(null, null, message, null);
    }

    public NodeExecutionException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public NodeExecutionException(Long nodeId, NodeType nodeType, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
        this.nodeType = nodeType;
    }

    public Long getNodeId() {
        return nodeId;
    }

    public NodeType getNodeType() {
        return nodeType;
    }
}
