package xyz.vvrf.reactor.workflow.exception;

/**
 * 运行不存在（从未创建或已被驱逐）。
 */
public class RunNotFoundException extends WorkflowException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super("run '" + runId + "' not found");
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
