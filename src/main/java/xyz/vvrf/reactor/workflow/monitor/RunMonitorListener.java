package xyz.vvrf.reactor.workflow.monitor;

import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.run.RunStatus;

import java.time.Duration;

/**
 * 用于监控工作流运行的监听器接口。
 * 包括运行级别和节点级别的回调，实现必须是线程安全的，抛出的异常会被记录并忽略。
 */
public interface RunMonitorListener {

    /**
     * 运行开始时调用（图已通过校验）。
     *
     * @param runId      运行 ID
     * @param workflowId 工作流 ID
     * @param nodeCount  节点数量
     */
    void onRunStart(String runId, long workflowId, int nodeCount);

    /**
     * 运行结束时调用（无论成功或失败）。
     *
     * @param runId         运行 ID
     * @param workflowId    工作流 ID
     * @param status        最终状态
     * @param totalDuration 运行总耗时
     */
    void onRunComplete(String runId, long workflowId, RunStatus status, Duration totalDuration);

    /**
     * 节点执行开始时调用。
     */
    void onNodeStart(String runId, long workflowId, WorkflowNode node);

    /**
     * 节点成功执行完成时调用。
     *
     * @param duration 包括重试在内的总耗时
     */
    void onNodeSuccess(String runId, long workflowId, WorkflowNode node, Duration duration, NodeResult result);

    /**
     * 节点在重试/超时后最终失败时调用。
     */
    void onNodeFailure(String runId, long workflowId, WorkflowNode node, Duration duration, Throwable error);

    /**
     * 节点被跳过时调用（分支未命中或上游失败）。
     *
     * @param reason branch_skipped 或 node_skipped
     */
    void onNodeSkipped(String runId, long workflowId, WorkflowNode node, String reason);

    /**
     * 单次执行尝试超时时调用，通常随后还会有 onNodeFailure 或一次重试。
     */
    void onNodeTimeout(String runId, long workflowId, WorkflowNode node, Duration timeout);
}
