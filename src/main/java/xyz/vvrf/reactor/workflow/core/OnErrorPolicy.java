package xyz.vvrf.reactor.workflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 节点执行失败时的处理策略，由节点 metadata 的 on_error 字段配置。
 */
public enum OnErrorPolicy {
    /**
     * 快速失败：运行标记为 failed 并停止调度。默认策略。
     */
    FAIL,

    /**
     * 跳过：记录 node_error 事件，依赖该节点输出的下游节点全部跳过，其余节点继续。
     */
    SKIP,

    /**
     * 继续：以空输出代替失败节点的输出，下游照常执行。
     */
    CONTINUE;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OnErrorPolicy of(String key) {
        if (key == null) {
            return FAIL;
        }
        for (OnErrorPolicy policy : values()) {
            if (policy.getKey().equals(key)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("on_error must be one of fail, skip, continue but was '" + key + "'");
    }
}
