package xyz.vvrf.reactor.workflow.node.action;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.metadata.MapMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * map：按 mapping 构造新对象，字符串值作为表达式求值，数字和布尔值作为字面量。
 */
@NodeServiceType(NodeType.MAP)
public class MapNodeService extends AbstractNodeService<MapMetadata> {

    public MapNodeService(NodeServiceSupport support) {
        super(NodeType.MAP, MapMetadata.class, support);
    }

    @Override
    protected void validateMetadata(MapMetadata metadata) {
        metadata.getMapping().forEach((key, value) -> {
            String path = "mapping." + key;
            if (value instanceof String) {
                checkExpression((String) value, path);
            } else if (!(value instanceof Number) && !(value instanceof Boolean)) {
                throw new NodeValidationException(path, "must be an expression string or a number/boolean literal");
            }
        });
    }

    @Override
    protected Map<String, Object> planShape(MapMetadata metadata, Map<String, Object> inputShape) {
        Map<String, Object> planned = new LinkedHashMap<>();
        if (metadata.getMapping() != null) {
            metadata.getMapping().forEach((key, value) ->
                    planned.put(key, value instanceof String ? Shapes.UNKNOWN : Shapes.typeName(value)));
        }
        return planned;
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, MapMetadata metadata) {
        Map<String, Object> output = new LinkedHashMap<>();
        metadata.getMapping().forEach((key, value) -> output.put(key,
                value instanceof String ? evaluate((String) value, input, "mapping." + key) : value));
        return output;
    }
}
