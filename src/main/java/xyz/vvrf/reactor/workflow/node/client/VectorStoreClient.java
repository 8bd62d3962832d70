package xyz.vvrf.reactor.workflow.node.client;

import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;

import java.util.List;
import java.util.Map;

/**
 * 向量库相似度查询接口。每条结果包含 id、score 和 payload。
 */
@FunctionalInterface
public interface VectorStoreClient {

    List<Map<String, Object>> query(String vectorStoreId, String namespace, String query,
                                    int topK, Map<String, Object> filters);

    static VectorStoreClient notConfigured() {
        return (vectorStoreId, namespace, query, topK, filters) -> {
            throw new NodeExecutionException("vector store client not configured");
        };
    }
}
