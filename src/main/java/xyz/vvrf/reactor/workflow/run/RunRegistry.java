package xyz.vvrf.reactor.workflow.run;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内的运行注册表，所有并发运行共享。
 * <p>
 * 不同运行之间互不干扰；同一运行内事件按追加顺序交付。
 * 后台驱逐任务只删除已过期的运行，正在执行的运行在开始后 TTL 内不会被删除。
 */
@Slf4j
public class RunRegistry {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(900);
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;

    private final Map<String, RunState> runs = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int queueCapacity;
    private final Clock clock;

    private volatile Disposable evictionTask;

    public RunRegistry(Duration ttl, int queueCapacity, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "TTL 不能为空");
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("事件通道容量必须为正数: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
    }

    public RunRegistry() {
        this(DEFAULT_TTL, DEFAULT_QUEUE_CAPACITY, Clock.systemUTC());
    }

    public RunState create(RunKind kind) {
        return create(kind, null);
    }

    public RunState create(RunKind kind, Long workflowId) {
        String runId = UUID.randomUUID().toString();
        RunState state = new RunState(runId, kind, workflowId, clock.instant(), queueCapacity);
        runs.put(runId, state);
        log.debug("[RunId: {}] 创建运行，类型: {}, 工作流: {}", runId, kind.getKey(), workflowId);
        return state;
    }

    /**
     * 追加事件。运行不存在时返回 false；通道已满时事件只进入日志并记录警告。
     */
    public boolean append(String runId, RunEvent event) {
        RunState state = runs.get(runId);
        if (state == null) {
            log.warn("[RunId: {}] 运行不存在，丢弃事件: {}", runId, event.getMessage());
            return false;
        }
        if (!state.append(event)) {
            log.warn("[RunId: {}] 事件通道已满 (容量: {})，事件 '{}' 只写入日志", runId, queueCapacity, event.getMessage());
        }
        return true;
    }

    public void markRunning(String runId) {
        get(runId).ifPresent(RunState::markRunning);
    }

    /**
     * 标记运行结束并设置 finished_at。重复调用无效。
     */
    public boolean finish(String runId, RunStatus status) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("运行只能以终止状态结束: " + status);
        }
        RunState state = runs.get(runId);
        if (state == null) {
            return false;
        }
        boolean finished = state.finish(status, clock.instant());
        if (finished) {
            log.info("[RunId: {}] 运行结束，状态: {}", runId, status.getKey());
        }
        return finished;
    }

    public Optional<RunState> get(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * 最多等待 timeout 取下一个未读事件；超时、运行不存在或线程被中断时返回空。
     */
    public Optional<RunEvent> popNext(String runId, Duration timeout) {
        RunState state = runs.get(runId);
        if (state == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(state.poll(timeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[RunId: {}] 等待事件时线程被中断", runId);
            return Optional.empty();
        }
    }

    /**
     * 请求取消，执行器在下一个节点开始前检查。
     *
     * @return 运行存在、尚未结束且此前未请求过取消
     */
    public boolean cancel(String runId) {
        RunState state = runs.get(runId);
        if (state == null) {
            return false;
        }
        boolean requested = state.requestCancel();
        if (requested) {
            log.info("[RunId: {}] 已请求取消运行", runId);
        }
        return requested;
    }

    /**
     * 删除过期的运行。
     *
     * @return 删除的数量
     */
    public int evictExpired(Instant now) {
        int evicted = 0;
        Iterator<Map.Entry<String, RunState>> iterator = runs.entrySet().iterator();
        while (iterator.hasNext()) {
            RunState state = iterator.next().getValue();
            if (state.isExpired(now, ttl)) {
                iterator.remove();
                evicted++;
                if (!state.isFinished()) {
                    log.warn("[RunId: {}] 运行从未结束且已超过 TTL ({})，视为遗弃并驱逐", state.getRunId(), ttl);
                }
            }
        }
        if (evicted > 0) {
            log.debug("驱逐了 {} 个过期运行，剩余 {}", evicted, runs.size());
        }
        return evicted;
    }

    public int size() {
        return runs.size();
    }

    /**
     * 启动周期驱逐任务。重复调用无效。
     */
    public synchronized void startEviction(Duration interval, Scheduler scheduler) {
        if (evictionTask != null && !evictionTask.isDisposed()) {
            return;
        }
        evictionTask = Flux.interval(interval, interval, scheduler)
                .subscribe(
                        tick -> evictExpired(clock.instant()),
                        error -> log.error("运行驱逐任务异常终止: {}", error.getMessage(), error));
        log.info("运行驱逐任务已启动，间隔: {}, TTL: {}", interval, ttl);
    }

    public synchronized void stop() {
        if (evictionTask != null) {
            evictionTask.dispose();
            evictionTask = null;
            log.info("运行驱逐任务已停止");
        }
    }

    public Duration getTtl() {
        return ttl;
    }
}
