package xyz.vvrf.reactor.workflow.execution;

import xyz.vvrf.reactor.workflow.exception.WorkflowException;

/**
 * 在节点之间检查到取消请求时抛出，终止当前运行（包括嵌套的子工作流）。
 */
public class RunCancelledException extends WorkflowException {

    public RunCancelledException(String runId) {
        super("run '" + runId + "' was cancelled");
    }
}
