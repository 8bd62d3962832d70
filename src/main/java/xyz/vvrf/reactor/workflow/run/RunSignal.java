package xyz.vvrf.reactor.workflow.run;

import java.util.Objects;
import java.util.Optional;

/**
 * 事件流中的一个信号：一条事件、一次心跳（等待超时）或结束。
 * 具体的传输格式（SSE 等）由传输层决定。
 */
public final class RunSignal {

    public enum Type {
        EVENT,
        HEARTBEAT,
        DONE
    }

    private static final RunSignal HEARTBEAT = new RunSignal(Type.HEARTBEAT, null);
    private static final RunSignal DONE = new RunSignal(Type.DONE, null);

    private final Type type;
    private final RunEvent event;

    private RunSignal(Type type, RunEvent event) {
        this.type = type;
        this.event = event;
    }

    public static RunSignal event(RunEvent event) {
        return new RunSignal(Type.EVENT, Objects.requireNonNull(event, "事件不能为空"));
    }

    public static RunSignal heartbeat() {
        return HEARTBEAT;
    }

    public static RunSignal done() {
        return DONE;
    }

    public Type getType() {
        return type;
    }

    public Optional<RunEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    @Override
    public String toString() {
        return type == Type.EVENT ? "RunSignal{EVENT " + event.getMessage() + "}" : "RunSignal{" + type + "}";
    }
}
