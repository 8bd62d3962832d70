package xyz.vvrf.reactor.workflow.node.action;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.expression.ExpressionContext;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.metadata.IfElseMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * if_else：对 predicate 求值，输出为输入加上 condition_result。
 * 执行器根据 condition_result 只激活标签匹配的出边。
 */
@NodeServiceType(NodeType.IF_ELSE)
public class IfElseNodeService extends AbstractNodeService<IfElseMetadata> {

    public static final String CONDITION_RESULT = "condition_result";

    public IfElseNodeService(NodeServiceSupport support) {
        super(NodeType.IF_ELSE, IfElseMetadata.class, support);
    }

    @Override
    protected void validateMetadata(IfElseMetadata metadata) {
        checkExpression(metadata.getPredicate(), "predicate");
    }

    @Override
    protected Map<String, Object> planShape(IfElseMetadata metadata, Map<String, Object> inputShape) {
        Map<String, Object> planned = new LinkedHashMap<>(inputShape);
        planned.put(CONDITION_RESULT, Shapes.BOOLEAN);
        return planned;
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, IfElseMetadata metadata) {
        boolean result = evaluateBoolean(metadata.getPredicate(), ExpressionContext.from(input), "predicate");
        Map<String, Object> output = new LinkedHashMap<>(input.getData());
        output.put(CONDITION_RESULT, result);
        return output;
    }
}
