package xyz.vvrf.reactor.workflow.node.client;

import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;

/**
 * job 节点调用的模型补全接口，返回模型生成的原始文本。
 */
@FunctionalInterface
public interface CompletionClient {

    String complete(CompletionRequest request);

    static CompletionClient notConfigured() {
        return request -> {
            throw new NodeExecutionException("completion client not configured");
        };
    }
}
