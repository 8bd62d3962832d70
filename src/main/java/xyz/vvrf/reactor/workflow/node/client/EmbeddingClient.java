package xyz.vvrf.reactor.workflow.node.client;

import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;

/**
 * embed 节点调用的向量化接口，返回写入的条数。
 */
@FunctionalInterface
public interface EmbeddingClient {

    int embed(EmbeddingRequest request);

    static EmbeddingClient notConfigured() {
        return request -> {
            throw new NodeExecutionException("embedding client not configured");
        };
    }
}
