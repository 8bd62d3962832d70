package xyz.vvrf.reactor.workflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 节点执行时的输入。
 * <ul>
 *     <li>data：已执行祖先节点真实输出的合并结果（入口节点为 starting_inputs）</li>
 *     <li>parentOutputs：直接父节点的输出，按入边声明顺序</li>
 *     <li>parentOutputsInTopoOrder：直接父节点的输出，按拓扑顺序</li>
 *     <li>item/index：仅在 for_each 循环体内存在</li>
 *     <li>structuredOutput：当前节点声明的输出形状</li>
 * </ul>
 */
public final class NodeInput {

    private final Map<String, Object> data;
    private final Map<Long, Map<String, Object>> parentOutputs;
    private final Map<Long, Map<String, Object>> parentOutputsInTopoOrder;
    private final Object item;
    private final Integer index;
    private final RunScope scope;
    private final Map<String, Object> structuredOutput;

    private NodeInput(Map<String, Object> data,
                      Map<Long, Map<String, Object>> parentOutputs,
                      Map<Long, Map<String, Object>> parentOutputsInTopoOrder,
                      Object item, Integer index, RunScope scope,
                      Map<String, Object> structuredOutput) {
        this.data = data == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.parentOutputs = parentOutputs == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parentOutputs));
        this.parentOutputsInTopoOrder = parentOutputsInTopoOrder == null
                ? this.parentOutputs
                : Collections.unmodifiableMap(new LinkedHashMap<>(parentOutputsInTopoOrder));
        this.item = item;
        this.index = index;
        this.scope = Objects.requireNonNull(scope, "运行作用域不能为空");
        this.structuredOutput = structuredOutput == null ? Collections.emptyMap() : structuredOutput;
    }

    public static NodeInput of(Map<String, Object> data,
                               Map<Long, Map<String, Object>> parentOutputs,
                               Map<Long, Map<String, Object>> parentOutputsInTopoOrder,
                               RunScope scope) {
        return new NodeInput(data, parentOutputs, parentOutputsInTopoOrder, null, null, scope, null);
    }

    /**
     * 只有合并数据、没有父节点信息的输入，常用于测试或预览。
     */
    public static NodeInput of(Map<String, Object> data, RunScope scope) {
        return new NodeInput(data, null, null, null, null, scope, null);
    }

    /**
     * 派生一个 for_each 迭代内的输入：data 中额外放入 item，并绑定 item/index。
     */
    public NodeInput withIteration(Object currentItem, int currentIndex) {
        Map<String, Object> iterationData = new LinkedHashMap<>(data);
        iterationData.put("item", currentItem);
        return new NodeInput(iterationData, parentOutputs, parentOutputsInTopoOrder, currentItem, currentIndex, scope, structuredOutput);
    }

    /**
     * 附带正在执行节点声明的 structured_output。
     */
    public NodeInput withStructuredOutput(Map<String, Object> declared) {
        return new NodeInput(data, parentOutputs, parentOutputsInTopoOrder, item, index, scope, declared);
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Map<Long, Map<String, Object>> getParentOutputs() {
        return parentOutputs;
    }

    public Map<Long, Map<String, Object>> getParentOutputsInTopoOrder() {
        return parentOutputsInTopoOrder;
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

    public RunScope getScope() {
        return scope;
    }

    public Map<String, Object> getStructuredOutput() {
        return structuredOutput;
    }

    @Override
    public String toString() {
        return "NodeInput{" +
                "dataKeys=" + data.keySet() +
                ", parents=" + parentOutputs.keySet() +
                (index != null ? ", index=" + index : "") +
                ", scope=" + scope +
                '}';
    }
}
