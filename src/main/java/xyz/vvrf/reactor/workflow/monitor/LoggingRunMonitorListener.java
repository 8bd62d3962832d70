package xyz.vvrf.reactor.workflow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.run.RunStatus;

import java.time.Duration;

@Slf4j
public class LoggingRunMonitorListener implements RunMonitorListener {

    @Override
    public void onRunStart(String runId, long workflowId, int nodeCount) {
        log.info("[MONITOR] 运行:[{}] 工作流:[{}] 开始。 节点数:[{}]", runId, workflowId, nodeCount);
    }

    @Override
    public void onRunComplete(String runId, long workflowId, RunStatus status, Duration totalDuration) {
        log.info("[MONITOR] 运行:[{}] 工作流:[{}] 结束。 状态:[{}], 耗时:[{}ms]",
                runId, workflowId, status.getKey(), totalDuration.toMillis());
    }

    @Override
    public void onNodeStart(String runId, long workflowId, WorkflowNode node) {
        log.info("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 开始。 类型:[{}]",
                runId, workflowId, node.getId(), node.getNodeType());
    }

    @Override
    public void onNodeSuccess(String runId, long workflowId, WorkflowNode node, Duration duration, NodeResult result) {
        log.info("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 成功。 耗时:[{}ms], 输出字段:[{}]",
                runId, workflowId, node.getId(), duration.toMillis(), result.getOutput().keySet());
    }

    @Override
    public void onNodeFailure(String runId, long workflowId, WorkflowNode node, Duration duration, Throwable error) {
        log.error("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}], 类型:[{}]",
                runId, workflowId, node.getId(), duration.toMillis(), error.getMessage(), node.getNodeType(), error);
    }

    @Override
    public void onNodeSkipped(String runId, long workflowId, WorkflowNode node, String reason) {
        log.info("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 跳过。 原因:[{}], 类型:[{}]",
                runId, workflowId, node.getId(), reason, node.getNodeType());
    }

    @Override
    public void onNodeTimeout(String runId, long workflowId, WorkflowNode node, Duration timeout) {
        log.warn("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 超时。 配置:[{}ms], 类型:[{}]",
                runId, workflowId, node.getId(), timeout.toMillis(), node.getNodeType());
    }
}
