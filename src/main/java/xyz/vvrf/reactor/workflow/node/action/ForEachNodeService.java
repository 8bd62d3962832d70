package xyz.vvrf.reactor.workflow.node.action;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.metadata.ForEachMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;

/**
 * for_each：只负责解析出待迭代的数组，输出 {"items": [...]}；
 * 循环体（所有后代节点）由执行器逐项驱动，最终输出替换为 {"items_processed", "results"}。
 */
@NodeServiceType(NodeType.FOR_EACH)
public class ForEachNodeService extends AbstractNodeService<ForEachMetadata> {

    public static final String ITEMS = "items";
    public static final String ITEMS_PROCESSED = "items_processed";
    public static final String RESULTS = "results";

    public ForEachNodeService(NodeServiceSupport support) {
        super(NodeType.FOR_EACH, ForEachMetadata.class, support);
    }

    @Override
    protected void validateMetadata(ForEachMetadata metadata) {
        checkExpression(metadata.getItemsSelector(), "items_selector");
    }

    @Override
    protected Map<String, Object> planShape(ForEachMetadata metadata, Map<String, Object> inputShape) {
        return shape(ITEMS_PROCESSED, Shapes.NUMBER, RESULTS, Shapes.ARRAY);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, ForEachMetadata metadata) {
        Object selected = evaluate(metadata.getItemsSelector(), input, "items_selector");
        if (selected == null) {
            return shape(ITEMS, new ArrayList<>());
        }
        if (!(selected instanceof Collection)) {
            throw new NodeExecutionException("items_selector must select an array but got " + Shapes.typeName(selected));
        }
        return shape(ITEMS, new ArrayList<>((Collection<?>) selected));
    }
}
