package xyz.vvrf.reactor.workflow.run;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 把一个运行的事件通道转换为 {@link Flux}：先交付积压事件，再交付实时事件，
 * 等待超时发出心跳，运行结束且通道排空后发出 done 并完成。
 * <p>
 * 通道只支持一个消费者，同一运行同时订阅多个流时事件会被它们瓜分。
 */
@Slf4j
public class RunEventStream {

    private final RunRegistry registry;
    private final Duration heartbeatInterval;
    private final Scheduler pollingScheduler;

    public RunEventStream(RunRegistry registry, Duration heartbeatInterval, Scheduler pollingScheduler) {
        this.registry = Objects.requireNonNull(registry, "RunRegistry 不能为空");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "心跳间隔不能为空");
        this.pollingScheduler = Objects.requireNonNull(pollingScheduler, "Scheduler 不能为空");
    }

    public Flux<RunSignal> stream(String runId) {
        return Flux.<RunSignal, Boolean>generate(() -> Boolean.FALSE, (completed, sink) -> {
                    if (completed) {
                        sink.complete();
                        return Boolean.TRUE;
                    }
                    Optional<RunState> state = registry.get(runId);
                    if (!state.isPresent()) {
                        // 运行已被驱逐
                        sink.next(RunSignal.done());
                        return Boolean.TRUE;
                    }
                    if (state.get().isFinished()) {
                        Optional<RunEvent> remaining = registry.popNext(runId, Duration.ZERO);
                        if (remaining.isPresent()) {
                            sink.next(RunSignal.event(remaining.get()));
                            return Boolean.FALSE;
                        }
                        sink.next(RunSignal.done());
                        return Boolean.TRUE;
                    }
                    Optional<RunEvent> next = registry.popNext(runId, heartbeatInterval);
                    sink.next(next.map(RunSignal::event).orElseGet(RunSignal::heartbeat));
                    return Boolean.FALSE;
                })
                .subscribeOn(pollingScheduler)
                .doOnSubscribe(subscription -> log.debug("[RunId: {}] 事件流已订阅", runId))
                .doOnCancel(() -> log.debug("[RunId: {}] 事件流订阅被取消", runId));
    }
}
