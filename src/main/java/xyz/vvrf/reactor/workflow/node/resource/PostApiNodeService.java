package xyz.vvrf.reactor.workflow.node.resource;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.client.HttpResourceClient;
import xyz.vvrf.reactor.workflow.node.client.HttpResponse;
import xyz.vvrf.reactor.workflow.node.metadata.PostApiMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * post_api：按 body_map 构造请求体并发起 POST 请求。输出 {"status", "body"}。
 */
@NodeServiceType(NodeType.POST_API)
public class PostApiNodeService extends AbstractNodeService<PostApiMetadata> {

    private final HttpResourceClient httpClient;
    private final HttpAuthPresets authPresets;

    public PostApiNodeService(NodeServiceSupport support, HttpResourceClient httpClient, HttpAuthPresets authPresets) {
        super(NodeType.POST_API, PostApiMetadata.class, support);
        this.httpClient = httpClient;
        this.authPresets = authPresets;
    }

    @Override
    protected void validateMetadata(PostApiMetadata metadata) {
        HttpUrls.checkAbsoluteHttpUrl(metadata.getUrl(), "url");
        if (metadata.getBodyMap() != null) {
            checkBodyMap(metadata.getBodyMap(), "body_map");
        }
    }

    private void checkBodyMap(Map<?, ?> bodyMap, String path) {
        for (Map.Entry<?, ?> entry : bodyMap.entrySet()) {
            String currentPath = path + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map) {
                checkBodyMap((Map<?, ?>) value, currentPath);
            } else if (value instanceof String) {
                checkExpression((String) value, currentPath);
            } else if (value != null && !(value instanceof Number) && !(value instanceof Boolean)) {
                throw new NodeValidationException(currentPath,
                        "must be an expression string, a literal value or a nested object");
            }
        }
    }

    @Override
    protected Map<String, Object> planShape(PostApiMetadata metadata, Map<String, Object> inputShape) {
        return shape("status", Shapes.NUMBER, "body", Shapes.OBJECT);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, PostApiMetadata metadata) {
        Map<String, Object> body = metadata.getBodyMap() == null
                ? new LinkedHashMap<>()
                : buildBody(metadata.getBodyMap(), input, "body_map");
        Map<String, String> headers = authPresets.headersFor(metadata.getAuthPreset(), metadata.getHeaders());
        HttpResponse response = httpClient.post(metadata.getUrl(), headers, metadata.getContentType(), body);
        return shape("status", response.getStatus(), "body", response.getBody());
    }

    private Map<String, Object> buildBody(Map<?, ?> template, NodeInput input, String path) {
        Map<String, Object> body = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : template.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String currentPath = path + "." + key;
            Object value = entry.getValue();
            if (value instanceof Map) {
                body.put(key, buildBody((Map<?, ?>) value, input, currentPath));
            } else if (value instanceof String) {
                body.put(key, evaluate((String) value, input, currentPath));
            } else {
                body.put(key, value);
            }
        }
        return body;
    }
}
