package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.run.RunEvent;
import xyz.vvrf.reactor.workflow.run.RunRegistry;
import xyz.vvrf.reactor.workflow.run.RunState;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单次运行的执行上下文：向注册表追加事件，统计节点结果，记录取消状态。
 * 子工作流与外层工作流共享同一个上下文。
 */
@Slf4j
public class RunExecutionContext {

    private final RunState state;
    private final RunRegistry runRegistry;
    private final Clock clock;
    private final AtomicBoolean cancellationReported = new AtomicBoolean(false);
    private final AtomicInteger executed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();

    public RunExecutionContext(RunState state, RunRegistry runRegistry, Clock clock) {
        this.state = state;
        this.runRegistry = runRegistry;
        this.clock = clock;
    }

    public String getRunId() {
        return state.getRunId();
    }

    public void info(String message, Map<String, Object> data) {
        append(RunEvent.info(clock.instant(), message, data));
    }

    public void warn(String message, Map<String, Object> data) {
        append(RunEvent.warn(clock.instant(), message, data));
    }

    public void error(String message, Map<String, Object> data) {
        append(RunEvent.error(clock.instant(), message, data));
    }

    private void append(RunEvent event) {
        log.trace("[RunId: {}] 事件: {}", state.getRunId(), event);
        runRegistry.append(state.getRunId(), event);
    }

    public boolean isCancelRequested() {
        return state.isCancelRequested();
    }

    /**
     * 发出 run_cancelled 事件，只在第一次调用时生效。
     */
    public void reportCancelled(Map<String, Object> data) {
        if (cancellationReported.compareAndSet(false, true)) {
            warn("run_cancelled", data);
        }
    }

    public boolean isCancellationReported() {
        return cancellationReported.get();
    }

    void nodeExecuted() {
        executed.incrementAndGet();
    }

    void nodeFailed() {
        failed.incrementAndGet();
    }

    void nodeSkipped() {
        skipped.incrementAndGet();
    }

    public Map<String, Object> counters() {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("nodes_executed", executed.get());
        counters.put("nodes_failed", failed.get());
        counters.put("nodes_skipped", skipped.get());
        return Collections.unmodifiableMap(counters);
    }
}
