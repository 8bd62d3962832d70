package xyz.vvrf.reactor.workflow.node.action;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.metadata.AdvancedMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * advanced：对任意表达式求值。结果是对象时直接作为输出，否则包装为 {"result": value}。
 */
@NodeServiceType(NodeType.ADVANCED)
public class AdvancedNodeService extends AbstractNodeService<AdvancedMetadata> {

    public AdvancedNodeService(NodeServiceSupport support) {
        super(NodeType.ADVANCED, AdvancedMetadata.class, support);
    }

    @Override
    protected void validateMetadata(AdvancedMetadata metadata) {
        checkExpression(metadata.getExpression(), "expression");
    }

    @Override
    protected Map<String, Object> planShape(AdvancedMetadata metadata, Map<String, Object> inputShape) {
        return shape("result", Shapes.UNKNOWN);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, AdvancedMetadata metadata) {
        Object value = evaluate(metadata.getExpression(), input, "expression");
        if (value instanceof Map) {
            Map<String, Object> output = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> output.put(String.valueOf(k), v));
            return output;
        }
        return shape("result", value);
    }
}
