package xyz.vvrf.reactor.workflow.exception;

/**
 * 按 id 找不到工作流（仓库查询或子工作流解析）。
 */
public class WorkflowNotFoundException extends WorkflowException {

    private final long workflowId;

    public WorkflowNotFoundException(long workflowId) {
        super("workflow " + workflowId + " not found");
        this.workflowId = workflowId;
    }

    public long getWorkflowId() {
        return workflowId;
    }
}
