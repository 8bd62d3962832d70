package xyz.vvrf.reactor.workflow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.exception.ExpressionTimeoutException;
import xyz.vvrf.reactor.workflow.run.RunStatus;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
public class MicrometerRunMonitorListener implements RunMonitorListener {

    // 指标名称
    static final String METRIC_NODE_EXECUTION_TIME = "workflow.node.execution.time";
    static final String METRIC_NODE_EXECUTION_TOTAL = "workflow.node.execution.total";
    static final String METRIC_NODE_TIMEOUT_TOTAL = "workflow.node.timeout.total";
    static final String METRIC_RUN_TIME = "workflow.run.time";

    // 标签键
    private static final String TAG_WORKFLOW = "workflow";
    private static final String TAG_NODE_TYPE = "node.type";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";

    // 状态标签值
    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";
    private static final String STATUS_SKIPPED = "SKIPPED";
    private static final String STATUS_TIMEOUT = "TIMEOUT";

    private final MeterRegistry meterRegistry;

    public MicrometerRunMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onRunStart(String runId, long workflowId, int nodeCount) {
        // 运行级别只在结束时记录
    }

    @Override
    public void onRunComplete(String runId, long workflowId, RunStatus status, Duration totalDuration) {
        try {
            Timer.builder(METRIC_RUN_TIME)
                    .tags(Tags.of(Tag.of(TAG_WORKFLOW, String.valueOf(workflowId)), Tag.of(TAG_STATUS, status.getKey())))
                    .description("工作流运行总耗时")
                    .register(meterRegistry)
                    .record(totalDuration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录运行计时器指标失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public void onNodeStart(String runId, long workflowId, WorkflowNode node) {
    }

    @Override
    public void onNodeSuccess(String runId, long workflowId, WorkflowNode node, Duration duration, NodeResult result) {
        Tags tags = nodeTags(workflowId, node, STATUS_SUCCESS);
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onNodeFailure(String runId, long workflowId, WorkflowNode node, Duration duration, Throwable error) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        boolean timedOut = isTimeout(error) || (error != null && isTimeout(error.getCause()));
        Tags tags = nodeTags(workflowId, node, timedOut ? STATUS_TIMEOUT : STATUS_FAILURE)
                .and(Tag.of(TAG_ERROR, errorTagValue));
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onNodeSkipped(String runId, long workflowId, WorkflowNode node, String reason) {
        incrementCounter(nodeTags(workflowId, node, STATUS_SKIPPED));
    }

    @Override
    public void onNodeTimeout(String runId, long workflowId, WorkflowNode node, Duration timeout) {
        Counter.builder(METRIC_NODE_TIMEOUT_TOTAL)
                .tags(nodeTags(workflowId, node, STATUS_TIMEOUT))
                .register(meterRegistry)
                .increment();
        log.debug("Micrometer 监听器捕获到节点 {} 的超时事件", node.getId());
    }

    private static boolean isTimeout(Throwable error) {
        return error instanceof TimeoutException || error instanceof ExpressionTimeoutException;
    }

    private Tags nodeTags(long workflowId, WorkflowNode node, String status) {
        return Tags.of(
                Tag.of(TAG_WORKFLOW, String.valueOf(workflowId)),
                Tag.of(TAG_NODE_TYPE, node.getNodeType().getKey()),
                Tag.of(TAG_STATUS, status)
        );
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer.builder(METRIC_NODE_EXECUTION_TIME)
                    .tags(tags)
                    .description("工作流节点执行时间")
                    .register(meterRegistry)
                    .record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter.builder(METRIC_NODE_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的工作流节点执行总数")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
