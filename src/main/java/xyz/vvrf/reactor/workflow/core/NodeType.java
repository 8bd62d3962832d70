package xyz.vvrf.reactor.workflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * 工作流节点类型（封闭集合）。
 * 每个类型有一个线上使用的 key（如 "get_api"）以及所属的语义分类。
 * 新增类型必须同时注册对应的 {@link NodeService}，否则注册表校验失败。
 */
public enum NodeType {

    JOB("job", NodeCategory.AI),
    EMBED("embed", NodeCategory.AI),

    GURU("guru", NodeCategory.RESOURCE),
    GET_API("get_api", NodeCategory.RESOURCE),
    POST_API("post_api", NodeCategory.RESOURCE),
    VECTOR_QUERY("vector_query", NodeCategory.RESOURCE),

    FILTER("filter", NodeCategory.ACTION),
    MAP("map", NodeCategory.ACTION),
    IF_ELSE("if_else", NodeCategory.ACTION),
    FOR_EACH("for_each", NodeCategory.ACTION),
    MERGE("merge", NodeCategory.ACTION),
    SPLIT("split", NodeCategory.ACTION),
    ADVANCED("advanced", NodeCategory.ACTION),
    RETURN("return", NodeCategory.ACTION),
    WORKFLOW("workflow", NodeCategory.ACTION);

    /**
     * 节点语义分组。
     */
    public enum NodeCategory {
        /** 模型调用（提示词、向量化） */
        AI,
        /** 外部系统调用 */
        RESOURCE,
        /** 纯数据变换或控制流 */
        ACTION
    }

    private final String key;
    private final NodeCategory category;

    NodeType(String key, NodeCategory category) {
        this.key = key;
        this.category = category;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public NodeCategory getCategory() {
        return category;
    }

    /**
     * 按线上 key 查找类型。
     */
    public static Optional<NodeType> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.key.equals(key))
                .findFirst();
    }

    @JsonCreator
    public static NodeType of(String key) {
        return fromKey(key).orElseThrow(() -> new IllegalArgumentException("未知的节点类型: " + key));
    }

    @Override
    public String toString() {
        return key;
    }
}
