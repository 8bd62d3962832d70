package xyz.vvrf.reactor.workflow.node.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 一批待向量化并写入向量库的文本。ids 与 metadata 为空或与 texts 等长。
 */
@Value
@Builder
public class EmbeddingRequest {
    String vectorStoreId;
    String namespace;
    String modelName;
    @Singular
    List<String> texts;
    List<String> ids;
    List<Map<String, Object>> metadata;
    boolean upsert;
}
