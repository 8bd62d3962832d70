package xyz.vvrf.reactor.workflow.node.resource;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.client.HttpResourceClient;
import xyz.vvrf.reactor.workflow.node.client.HttpResponse;
import xyz.vvrf.reactor.workflow.node.metadata.GetApiMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.Map;

/**
 * get_api：发起 GET 请求，query_map 的值是表达式。输出 {"status", "body"}。
 */
@NodeServiceType(NodeType.GET_API)
public class GetApiNodeService extends AbstractNodeService<GetApiMetadata> {

    private final HttpResourceClient httpClient;
    private final HttpAuthPresets authPresets;

    public GetApiNodeService(NodeServiceSupport support, HttpResourceClient httpClient, HttpAuthPresets authPresets) {
        super(NodeType.GET_API, GetApiMetadata.class, support);
        this.httpClient = httpClient;
        this.authPresets = authPresets;
    }

    @Override
    protected void validateMetadata(GetApiMetadata metadata) {
        HttpUrls.checkAbsoluteHttpUrl(metadata.getUrl(), "url");
        checkExpressionMap(metadata.getQueryMap(), "query_map");
    }

    @Override
    protected Map<String, Object> planShape(GetApiMetadata metadata, Map<String, Object> inputShape) {
        return shape("status", Shapes.NUMBER, "body", Shapes.OBJECT);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, GetApiMetadata metadata) {
        Map<String, Object> query = evaluateMap(metadata.getQueryMap(), input, "query_map");
        Map<String, String> headers = authPresets.headersFor(metadata.getAuthPreset(), metadata.getHeaders());
        HttpResponse response = httpClient.get(metadata.getUrl(), headers, query);
        return shape("status", response.getStatus(), "body", response.getBody());
    }
}
