package xyz.vvrf.reactor.workflow.exception;

/**
 * 工作流框架所有运行时异常的基类。
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
