package xyz.vvrf.reactor.workflow.planning;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 浅层“并集合并”：
 * <ul>
 *     <li>只出现在一个来源中的 key 原样保留</li>
 *     <li>多个来源中值相同的 key 原样保留</li>
 *     <li>多个来源中值冲突的 key 取最后一个来源（调用方按拓扑顺序传入），并追加一条冲突说明</li>
 * </ul>
 * 形状规划、可用数据解析和 merge 节点的 union 策略共用这一规则。
 */
public final class UnionMerger {

    private UnionMerger() {}

    /**
     * 合并结果：合并后的对象和冲突说明。
     */
    public static final class Result {
        private final Map<String, Object> merged;
        private final List<String> notes;

        private Result(Map<String, Object> merged, List<String> notes) {
            this.merged = merged;
            this.notes = notes;
        }

        public Map<String, Object> getMerged() {
            return merged;
        }

        public List<String> getNotes() {
            return notes;
        }
    }

    /**
     * @param sourcesInOrder 来源节点 id 到对象的映射，迭代顺序即优先级（后者覆盖前者）
     */
    public static Result merge(Map<Long, Map<String, Object>> sourcesInOrder) {
        Map<String, Object> merged = new LinkedHashMap<>();
        Map<String, List<Long>> contributors = new LinkedHashMap<>();
        Set<String> conflicting = new LinkedHashSet<>();

        for (Map.Entry<Long, Map<String, Object>> source : sourcesInOrder.entrySet()) {
            if (source.getValue() == null) {
                continue;
            }
            for (Map.Entry<String, Object> entry : source.getValue().entrySet()) {
                String key = entry.getKey();
                if (merged.containsKey(key) && !Objects.equals(merged.get(key), entry.getValue())) {
                    conflicting.add(key);
                }
                merged.put(key, entry.getValue());
                contributors.computeIfAbsent(key, k -> new ArrayList<>()).add(source.getKey());
            }
        }

        List<String> notes = new ArrayList<>();
        for (String key : conflicting) {
            List<Long> ids = contributors.get(key);
            notes.add(String.format("key '%s' conflicts between parents %s; using value from %d",
                    key,
                    ids.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]")),
                    ids.get(ids.size() - 1)));
        }
        return new Result(merged, notes);
    }

    /**
     * 按拓扑下标排列来源，使合并时后出现者覆盖前者。没有值的来源被忽略。
     */
    public static Map<Long, Map<String, Object>> inTopoOrder(Collection<Long> sourceIds,
                                                            List<Long> topoOrder,
                                                            Map<Long, Map<String, Object>> values) {
        Map<Long, Map<String, Object>> ordered = new LinkedHashMap<>();
        for (Long id : topoOrder) {
            if (sourceIds.contains(id) && values.containsKey(id)) {
                ordered.put(id, values.get(id));
            }
        }
        return ordered;
    }
}
