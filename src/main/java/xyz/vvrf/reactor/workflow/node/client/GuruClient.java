package xyz.vvrf.reactor.workflow.node.client;

import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;

import java.util.List;
import java.util.Map;

/**
 * guru 知识空间检索接口。
 */
@FunctionalInterface
public interface GuruClient {

    List<Map<String, Object>> search(String space, String query, int topK, Map<String, Object> filters);

    static GuruClient notConfigured() {
        return (space, query, topK, filters) -> {
            throw new NodeExecutionException("guru client not configured");
        };
    }
}
