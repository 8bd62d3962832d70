package xyz.vvrf.reactor.workflow.run;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次运行在内存中的状态。
 * <p>
 * 事件同时写入只增不减的日志和有界通道：日志供快照查询，通道供唯一的流式消费者按 FIFO 读取。
 * 只有驱动该运行的执行器追加事件。
 */
public final class RunState {

    private final String runId;
    private final RunKind kind;
    private final Long workflowId;
    private final Instant startedAt;
    private final List<RunEvent> events = new CopyOnWriteArrayList<>();
    private final BlockingQueue<RunEvent> channel;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private volatile RunStatus status = RunStatus.CREATED;
    private volatile Instant finishedAt;

    RunState(String runId, RunKind kind, Long workflowId, Instant startedAt, int channelCapacity) {
        this.runId = Objects.requireNonNull(runId, "运行 ID 不能为空");
        this.kind = Objects.requireNonNull(kind, "运行类型不能为空");
        this.workflowId = workflowId;
        this.startedAt = Objects.requireNonNull(startedAt, "开始时间不能为空");
        this.channel = new LinkedBlockingQueue<>(channelCapacity);
    }

    public String getRunId() {
        return runId;
    }

    public RunKind getKind() {
        return kind;
    }

    public Optional<Long> getWorkflowId() {
        return Optional.ofNullable(workflowId);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isFinished() {
        return finishedAt != null;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * 当前日志的快照。
     */
    public List<RunEvent> getEvents() {
        return new ArrayList<>(events);
    }

    public int getPendingCount() {
        return channel.size();
    }

    /**
     * @return 事件是否进入了通道；通道已满时只写入日志
     */
    boolean append(RunEvent event) {
        events.add(event);
        return channel.offer(event);
    }

    void markRunning() {
        if (status == RunStatus.CREATED) {
            status = RunStatus.RUNNING;
        }
    }

    /**
     * 结束运行。只有第一次调用生效。
     */
    synchronized boolean finish(RunStatus finalStatus, Instant at) {
        if (finishedAt != null) {
            return false;
        }
        this.status = finalStatus;
        this.finishedAt = at;
        return true;
    }

    boolean requestCancel() {
        return !isFinished() && cancelRequested.compareAndSet(false, true);
    }

    RunEvent poll(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return channel.poll();
        }
        return channel.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * 已结束且超过 TTL，或从未结束且开始时间超过 TTL（视为被遗弃）。
     */
    boolean isExpired(Instant now, Duration ttl) {
        Instant reference = finishedAt != null ? finishedAt : startedAt;
        return reference.plus(ttl).isBefore(now);
    }

    @Override
    public String toString() {
        return "RunState{" +
                "runId='" + runId + '\'' +
                ", kind=" + kind.getKey() +
                ", status=" + status.getKey() +
                ", events=" + events.size() +
                '}';
    }
}
