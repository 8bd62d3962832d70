package xyz.vvrf.reactor.workflow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;

/**
 * 负责调用单个节点：查找实现、应用超时与重试并通知监听器。
 * 返回的 Mono 不以错误结束，失败以 {@link NodeResult#failure(Throwable)} 表示。
 */
public interface NodeInvoker {

    Mono<NodeResult> invoke(WorkflowNode node, NodeInput input);
}
