package xyz.vvrf.reactor.workflow.node.action;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.expression.ExpressionContext;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.metadata.SplitMetadata;
import xyz.vvrf.reactor.workflow.node.metadata.SplitMode;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.*;

/**
 * split：把 items_selector 选出的数组按 key 分组（group_by）或按固定大小分块（chunk）。
 */
@NodeServiceType(NodeType.SPLIT)
public class SplitNodeService extends AbstractNodeService<SplitMetadata> {

    public SplitNodeService(NodeServiceSupport support) {
        super(NodeType.SPLIT, SplitMetadata.class, support);
    }

    @Override
    protected void validateMetadata(SplitMetadata metadata) {
        checkExpression(metadata.getBy(), "by");
        checkExpression(metadata.getItemsSelector(), "items_selector");
    }

    @Override
    protected Map<String, Object> planShape(SplitMetadata metadata, Map<String, Object> inputShape) {
        return metadata.getMode() == SplitMode.CHUNK
                ? shape("chunks", Shapes.ARRAY)
                : shape("groups", Shapes.OBJECT);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, SplitMetadata metadata) {
        Object selected = evaluate(metadata.getItemsSelector(), input, "items_selector");
        if (!(selected instanceof Collection)) {
            throw new NodeExecutionException("items_selector must select an array but got " + Shapes.typeName(selected));
        }
        List<Object> items = new ArrayList<>((Collection<?>) selected);

        if (metadata.getMode() == SplitMode.CHUNK) {
            int size = metadata.getChunkSize();
            List<List<Object>> chunks = new ArrayList<>();
            for (int start = 0; start < items.size(); start += size) {
                chunks.add(new ArrayList<>(items.subList(start, Math.min(start + size, items.size()))));
            }
            return shape("chunks", chunks);
        }

        ExpressionContext context = ExpressionContext.from(input);
        Map<String, List<Object>> groups = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            Object key = support.getExpressionEvaluator().evaluate(metadata.getBy(), context.withIteration(item, i), "by");
            groups.computeIfAbsent(String.valueOf(key), k -> new ArrayList<>()).add(item);
        }
        return shape("groups", groups);
    }
}
