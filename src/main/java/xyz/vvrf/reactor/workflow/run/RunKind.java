package xyz.vvrf.reactor.workflow.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunKind {
    EXPERT,
    WORKFLOW;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunKind of(String key) {
        for (RunKind kind : values()) {
            if (kind.getKey().equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown run kind '" + key + "'");
    }
}
