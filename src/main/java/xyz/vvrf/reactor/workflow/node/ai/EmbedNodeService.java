package xyz.vvrf.reactor.workflow.node.ai;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.client.EmbeddingClient;
import xyz.vvrf.reactor.workflow.node.client.EmbeddingRequest;
import xyz.vvrf.reactor.workflow.node.metadata.EmbedMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.*;

/**
 * embed：选出文本并写入向量库。
 * input_selector 的结果可以是单个字符串或字符串数组；id_selector 的结果须与之等长。
 */
@NodeServiceType(NodeType.EMBED)
public class EmbedNodeService extends AbstractNodeService<EmbedMetadata> {

    private final EmbeddingClient embeddingClient;

    public EmbedNodeService(NodeServiceSupport support, EmbeddingClient embeddingClient) {
        super(NodeType.EMBED, EmbedMetadata.class, support);
        this.embeddingClient = embeddingClient;
    }

    @Override
    protected void validateMetadata(EmbedMetadata metadata) {
        checkExpression(metadata.getInputSelector(), "input_selector");
        checkOptionalExpression(metadata.getIdSelector(), "id_selector");
        checkExpressionMap(metadata.getMetadataMap(), "metadata_map");
    }

    @Override
    protected Map<String, Object> planShape(EmbedMetadata metadata, Map<String, Object> inputShape) {
        return shape("embedded", Shapes.BOOLEAN, "count", Shapes.NUMBER);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, EmbedMetadata metadata) {
        List<String> texts = asStrings(evaluate(metadata.getInputSelector(), input, "input_selector"), "input_selector");
        List<String> ids = null;
        if (metadata.getIdSelector() != null) {
            ids = asStrings(evaluate(metadata.getIdSelector(), input, "id_selector"), "id_selector");
            if (ids.size() != texts.size()) {
                throw new NodeExecutionException(String.format(
                        "id_selector produced %d ids for %d texts", ids.size(), texts.size()));
            }
        }
        List<Map<String, Object>> vectorMetadata = null;
        if (metadata.getMetadataMap() != null && !metadata.getMetadataMap().isEmpty()) {
            Map<String, Object> shared = evaluateMap(metadata.getMetadataMap(), input, "metadata_map");
            vectorMetadata = Collections.nCopies(texts.size(), shared);
        }
        if (texts.isEmpty()) {
            return shape("embedded", false, "count", 0);
        }

        int count = embeddingClient.embed(EmbeddingRequest.builder()
                .vectorStoreId(metadata.getVectorStoreId())
                .namespace(metadata.getNamespace())
                .modelName(metadata.getModelName())
                .texts(texts)
                .ids(ids)
                .metadata(vectorMetadata)
                .upsert(!Boolean.FALSE.equals(metadata.getUpsert()))
                .build());
        return shape("embedded", count > 0, "count", count);
    }

    private static List<String> asStrings(Object value, String fieldPath) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof Collection) {
            List<String> strings = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                if (element != null) {
                    strings.add(String.valueOf(element));
                }
            }
            return strings;
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return Collections.singletonList(String.valueOf(value));
        }
        throw new NodeExecutionException(fieldPath + " must select a string or an array of strings but got " + Shapes.typeName(value));
    }
}
