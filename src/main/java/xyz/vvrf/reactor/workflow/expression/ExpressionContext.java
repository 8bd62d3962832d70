package xyz.vvrf.reactor.workflow.expression;

import xyz.vvrf.reactor.workflow.core.NodeInput;

import java.util.Collections;
import java.util.Map;

/**
 * 表达式求值上下文。
 * <ul>
 *     <li>{@code #base}：环境提供的值（时间、运行 id 等）</li>
 *     <li>{@code #input}：调用方数据，同时也是根对象，所以 {@code text} 与 {@code #input['text']} 等价</li>
 *     <li>{@code #item} / {@code #index}：仅在迭代中绑定</li>
 * </ul>
 */
public final class ExpressionContext {

    private final Map<String, Object> base;
    private final Map<String, Object> input;
    private final Object item;
    private final Integer index;

    private ExpressionContext(Map<String, Object> base, Map<String, Object> input, Object item, Integer index) {
        this.base = base == null ? Collections.emptyMap() : base;
        this.input = input == null ? Collections.emptyMap() : input;
        this.item = item;
        this.index = index;
    }

    public static ExpressionContext of(Map<String, Object> base, Map<String, Object> input) {
        return new ExpressionContext(base, input, null, null);
    }

    public static ExpressionContext ofInput(Map<String, Object> input) {
        return new ExpressionContext(null, input, null, null);
    }

    /**
     * 由节点输入构建上下文，迭代中的 item/index 一并带上。
     */
    public static ExpressionContext from(NodeInput nodeInput) {
        return new ExpressionContext(nodeInput.getScope().getBase(), nodeInput.getData(),
                nodeInput.getItem(), nodeInput.getIndex());
    }

    public ExpressionContext withIteration(Object currentItem, int currentIndex) {
        return new ExpressionContext(base, input, currentItem, currentIndex);
    }

    public Map<String, Object> getBase() {
        return base;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    public Object getItem() {
        return item;
    }

    public Integer getIndex() {
        return index;
    }

    public boolean isIteration() {
        return index != null;
    }
}
