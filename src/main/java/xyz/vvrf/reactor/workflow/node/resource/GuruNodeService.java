package xyz.vvrf.reactor.workflow.node.resource;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.client.GuruClient;
import xyz.vvrf.reactor.workflow.node.metadata.GuruMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.List;
import java.util.Map;

/**
 * guru：在知识空间中检索，输出 {"items": [...]}。
 */
@NodeServiceType(NodeType.GURU)
public class GuruNodeService extends AbstractNodeService<GuruMetadata> {

    private final GuruClient guruClient;

    public GuruNodeService(NodeServiceSupport support, GuruClient guruClient) {
        super(NodeType.GURU, GuruMetadata.class, support);
        this.guruClient = guruClient;
    }

    @Override
    protected void validateMetadata(GuruMetadata metadata) {
        checkTemplate(metadata.getQueryTemplate(), "query_template");
    }

    @Override
    protected Map<String, Object> planShape(GuruMetadata metadata, Map<String, Object> inputShape) {
        return shape("items", Shapes.ARRAY);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, GuruMetadata metadata) {
        String query = render(metadata.getQueryTemplate(), input, "query_template");
        int topK = metadata.getTopK() == null ? 5 : metadata.getTopK();
        List<Map<String, Object>> items = guruClient.search(metadata.getSpace(), query, topK, metadata.getFilters());
        return shape("items", items);
    }
}
