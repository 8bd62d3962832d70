package xyz.vvrf.reactor.workflow.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 运行日志中的一条事件（不可变）。message 是事件名（如 node_start），细节放在 data 中。
 */
public final class RunEvent {

    public enum Level {
        INFO,
        WARN,
        ERROR;

        @JsonValue
        public String getKey() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Level of(String key) {
            for (Level level : values()) {
                if (level.getKey().equals(key)) {
                    return level;
                }
            }
            throw new IllegalArgumentException("unknown event level '" + key + "'");
        }
    }

    private final Instant timestamp;
    private final Level level;
    private final String message;
    private final Map<String, Object> data;

    @JsonCreator
    public RunEvent(@JsonProperty("timestamp") Instant timestamp,
                    @JsonProperty("level") Level level,
                    @JsonProperty("message") String message,
                    @JsonProperty("data") Map<String, Object> data) {
        this.timestamp = Objects.requireNonNull(timestamp, "事件时间不能为空");
        this.level = Objects.requireNonNull(level, "事件级别不能为空");
        this.message = Objects.requireNonNull(message, "事件消息不能为空");
        this.data = data == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static RunEvent info(Instant timestamp, String message, Map<String, Object> data) {
        return new RunEvent(timestamp, Level.INFO, message, data);
    }

    public static RunEvent warn(Instant timestamp, String message, Map<String, Object> data) {
        return new RunEvent(timestamp, Level.WARN, message, data);
    }

    public static RunEvent error(Instant timestamp, String message, Map<String, Object> data) {
        return new RunEvent(timestamp, Level.ERROR, message, data);
    }

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("level")
    public Level getLevel() {
        return level;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("data")
    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunEvent runEvent = (RunEvent) o;
        return timestamp.equals(runEvent.timestamp) &&
                level == runEvent.level &&
                message.equals(runEvent.message) &&
                data.equals(runEvent.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, level, message, data);
    }

    @Override
    public String toString() {
        return "RunEvent{" +
                "timestamp=" + timestamp +
                ", level=" + level.getKey() +
                ", message='" + message + '\'' +
                ", dataKeys=" + data.keySet() +
                '}';
    }
}
