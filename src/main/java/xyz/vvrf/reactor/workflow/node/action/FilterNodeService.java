package xyz.vvrf.reactor.workflow.node.action;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.expression.ExpressionContext;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.metadata.FilterMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * filter：
 * 配置了 items_selector 时，保留使 where 为真的元素（元素绑定为 #item），输出 {"items": [...]}；
 * 否则 where 为真时原样透传输入，为假时输出空对象。
 */
@NodeServiceType(NodeType.FILTER)
public class FilterNodeService extends AbstractNodeService<FilterMetadata> {

    public FilterNodeService(NodeServiceSupport support) {
        super(NodeType.FILTER, FilterMetadata.class, support);
    }

    @Override
    protected void validateMetadata(FilterMetadata metadata) {
        checkExpression(metadata.getWhere(), "where");
        checkOptionalExpression(metadata.getItemsSelector(), "items_selector");
    }

    @Override
    protected Map<String, Object> planShape(FilterMetadata metadata, Map<String, Object> inputShape) {
        if (metadata.getItemsSelector() != null) {
            return shape("items", Shapes.ARRAY);
        }
        return new LinkedHashMap<>(inputShape);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, FilterMetadata metadata) {
        ExpressionContext context = ExpressionContext.from(input);
        if (metadata.getItemsSelector() == null) {
            return evaluateBoolean(metadata.getWhere(), context, "where")
                    ? new LinkedHashMap<>(input.getData())
                    : new LinkedHashMap<>();
        }
        Object selected = evaluate(metadata.getItemsSelector(), input, "items_selector");
        if (!(selected instanceof Collection)) {
            throw new NodeExecutionException("items_selector must select an array but got " + Shapes.typeName(selected));
        }
        List<Object> kept = new ArrayList<>();
        int index = 0;
        for (Object item : (Collection<?>) selected) {
            if (evaluateBoolean(metadata.getWhere(), context.withIteration(item, index), "where")) {
                kept.add(item);
            }
            index++;
        }
        return shape("items", kept);
    }
}
