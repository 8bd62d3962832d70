package xyz.vvrf.reactor.workflow.node.resource;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.client.VectorStoreClient;
import xyz.vvrf.reactor.workflow.node.metadata.VectorQueryMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.List;
import java.util.Map;

/**
 * vector_query：向量库相似度查询，输出 {"results": [{id, score, payload}]}。
 */
@NodeServiceType(NodeType.VECTOR_QUERY)
public class VectorQueryNodeService extends AbstractNodeService<VectorQueryMetadata> {

    private final VectorStoreClient vectorStoreClient;

    public VectorQueryNodeService(NodeServiceSupport support, VectorStoreClient vectorStoreClient) {
        super(NodeType.VECTOR_QUERY, VectorQueryMetadata.class, support);
        this.vectorStoreClient = vectorStoreClient;
    }

    @Override
    protected void validateMetadata(VectorQueryMetadata metadata) {
        checkTemplate(metadata.getQueryTemplate(), "query_template");
    }

    @Override
    protected Map<String, Object> planShape(VectorQueryMetadata metadata, Map<String, Object> inputShape) {
        return shape("results", shape(
                "type", Shapes.ARRAY,
                "items", shape("id", Shapes.STRING, "score", Shapes.NUMBER, "payload", Shapes.OBJECT)));
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, VectorQueryMetadata metadata) {
        String query = render(metadata.getQueryTemplate(), input, "query_template");
        int topK = metadata.getTopK() == null ? 5 : metadata.getTopK();
        List<Map<String, Object>> results = vectorStoreClient.query(
                metadata.getVectorStoreId(), metadata.getNamespace(), query, topK, metadata.getFilters());
        return shape("results", results);
    }
}
