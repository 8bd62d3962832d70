package xyz.vvrf.reactor.workflow.node.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * merge 节点合并父节点输出的策略。
 */
public enum MergeStrategy {
    /** 浅合并，拓扑顺序靠后的父节点覆盖同名 key */
    UNION("union"),
    /** 数组拼接，对象合并，其余值后者覆盖 */
    CONCAT("concat"),
    /** 按边声明顺序取第一个非空值 */
    PREFER_LEFT("prefer_left");

    private final String key;

    MergeStrategy(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static MergeStrategy of(String key) {
        for (MergeStrategy strategy : values()) {
            if (strategy.key.equals(key)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("strategy must be one of union, concat, prefer_left but was '" + key + "'");
    }
}
