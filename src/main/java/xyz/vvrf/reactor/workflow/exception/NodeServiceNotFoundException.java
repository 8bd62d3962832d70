package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.core.NodeType;

/**
 * 某个节点类型没有注册实现。属于致命的配置错误。
 */
public class NodeServiceNotFoundException extends WorkflowException {

    private final NodeType nodeType;

    public NodeServiceNotFoundException(NodeType nodeType) {
        super("no node service registered for type '" + nodeType + "'");
        this.nodeType = nodeType;
    }

    public NodeType getNodeType() {
        return nodeType;
    }
}
