package xyz.vvrf.reactor.workflow.node.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * split 节点的拆分方式。
 */
public enum SplitMode {
    GROUP_BY("group_by"),
    CHUNK("chunk");

    private final String key;

    SplitMode(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static SplitMode of(String key) {
        for (SplitMode mode : values()) {
            if (mode.key.equals(key)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("mode must be one of group_by, chunk but was '" + key + "'");
    }
}
