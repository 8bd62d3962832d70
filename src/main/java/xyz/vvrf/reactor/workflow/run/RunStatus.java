package xyz.vvrf.reactor.workflow.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 运行状态机：created -> running -> (succeeded | failed)，之后由注册表驱逐。
 */
public enum RunStatus {
    CREATED,
    RUNNING,
    SUCCEEDED,
    FAILED;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    @JsonCreator
    public static RunStatus of(String key) {
        for (RunStatus status : values()) {
            if (status.getKey().equals(key)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown run status '" + key + "'");
    }
}
