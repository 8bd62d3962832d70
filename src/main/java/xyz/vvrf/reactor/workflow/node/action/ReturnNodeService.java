package xyz.vvrf.reactor.workflow.node.action;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.metadata.ContentType;
import xyz.vvrf.reactor.workflow.node.metadata.ReturnMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.Map;

/**
 * return：选出工作流的返回值，输出 {"payload", "status_code", "content_type"}。
 */
@NodeServiceType(NodeType.RETURN)
public class ReturnNodeService extends AbstractNodeService<ReturnMetadata> {

    public static final String PAYLOAD = "payload";

    public ReturnNodeService(NodeServiceSupport support) {
        super(NodeType.RETURN, ReturnMetadata.class, support);
    }

    @Override
    protected void validateMetadata(ReturnMetadata metadata) {
        checkExpression(metadata.getPayloadSelector(), "payload_selector");
    }

    @Override
    protected Map<String, Object> planShape(ReturnMetadata metadata, Map<String, Object> inputShape) {
        return shape(PAYLOAD, Shapes.UNKNOWN, "status_code", Shapes.NUMBER, "content_type", Shapes.STRING);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, ReturnMetadata metadata) {
        Object payload = evaluate(metadata.getPayloadSelector(), input, "payload_selector");
        ContentType contentType = metadata.getContentType() == null ? ContentType.JSON : metadata.getContentType();
        int statusCode = metadata.getStatusCode() == null ? 200 : metadata.getStatusCode();
        return shape(PAYLOAD, payload, "status_code", statusCode, "content_type", contentType.getMediaType());
    }
}
