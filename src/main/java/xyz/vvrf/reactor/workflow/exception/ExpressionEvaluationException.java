package xyz.vvrf.reactor.workflow.exception;

/**
 * 表达式可以解析，但在运行时求值失败。作为运行事件报告，不会中断进程。
 */
public class ExpressionEvaluationException extends WorkflowException {

    private final String expression;
    private final String path;

    public ExpressionEvaluationException(String expression, String path, String reason, Throwable cause) {
        super(String.format("expression at '%s' failed: %s (%s)", path, expression, reason), cause);
        this.expression = expression;
        this.path = path;
    }

    public String getExpression() {
        return expression;
    }

    public String getPath() {
        return path;
    }
}
