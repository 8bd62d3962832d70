package xyz.vvrf.reactor.workflow.node.action;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.metadata.MergeMetadata;
import xyz.vvrf.reactor.workflow.node.metadata.MergeStrategy;
import xyz.vvrf.reactor.workflow.planning.UnionMerger;

import java.util.*;

/**
 * merge：合并直接父节点的输出。
 * <ul>
 *     <li>union：浅合并，拓扑顺序靠后的父节点覆盖</li>
 *     <li>concat：数组拼接，对象合并，其余值后者覆盖（拓扑顺序）</li>
 *     <li>prefer_left：按入边声明顺序，每个 key 取第一个非空值</li>
 * </ul>
 * 没有父节点时（作为入口节点）输出合并后的输入本身。
 */
@Slf4j
@NodeServiceType(NodeType.MERGE)
public class MergeNodeService extends AbstractNodeService<MergeMetadata> {

    public MergeNodeService(NodeServiceSupport support) {
        super(NodeType.MERGE, MergeMetadata.class, support);
    }

    @Override
    protected Map<String, Object> planShape(MergeMetadata metadata, Map<String, Object> inputShape) {
        return new LinkedHashMap<>(inputShape);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, MergeMetadata metadata) {
        if (input.getParentOutputs().isEmpty()) {
            return new LinkedHashMap<>(input.getData());
        }
        if (metadata.getExpectedParents() != null && metadata.getExpectedParents() != input.getParentOutputs().size()) {
            log.warn("[RunId: {}] merge 节点期望 {} 个父节点输出，实际收到 {} 个",
                    input.getScope().getRunId(), metadata.getExpectedParents(), input.getParentOutputs().size());
        }
        MergeStrategy strategy = metadata.getStrategy() == null ? MergeStrategy.UNION : metadata.getStrategy();
        switch (strategy) {
            case CONCAT:
                return concat(input.getParentOutputsInTopoOrder().values());
            case PREFER_LEFT:
                return preferLeft(input.getParentOutputs().values());
            case UNION:
            default:
                return UnionMerger.merge(input.getParentOutputsInTopoOrder()).getMerged();
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> concat(Collection<Map<String, Object>> outputs) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map<String, Object> output : outputs) {
            for (Map.Entry<String, Object> entry : output.entrySet()) {
                Object existing = merged.get(entry.getKey());
                Object value = entry.getValue();
                if (existing instanceof Collection && value instanceof Collection) {
                    List<Object> combined = new ArrayList<>((Collection<Object>) existing);
                    combined.addAll((Collection<Object>) value);
                    merged.put(entry.getKey(), combined);
                } else if (existing instanceof Map && value instanceof Map) {
                    Map<String, Object> combined = new LinkedHashMap<>((Map<String, Object>) existing);
                    combined.putAll((Map<String, Object>) value);
                    merged.put(entry.getKey(), combined);
                } else if (value instanceof Collection) {
                    merged.put(entry.getKey(), new ArrayList<>((Collection<Object>) value));
                } else {
                    merged.put(entry.getKey(), value);
                }
            }
        }
        return merged;
    }

    static Map<String, Object> preferLeft(Collection<Map<String, Object>> outputsInDeclarationOrder) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map<String, Object> output : outputsInDeclarationOrder) {
            for (Map.Entry<String, Object> entry : output.entrySet()) {
                if (merged.get(entry.getKey()) == null && entry.getValue() != null) {
                    merged.put(entry.getKey(), entry.getValue());
                } else if (!merged.containsKey(entry.getKey())) {
                    merged.put(entry.getKey(), null);
                }
            }
        }
        return merged;
    }
}
