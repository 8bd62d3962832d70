package xyz.vvrf.reactor.workflow.exception;

/**
 * 表达式无法解析。在节点校验阶段报告，不会执行任何表达式。
 */
public class ExpressionSyntaxException extends WorkflowException {

    private final String expression;
    private final String path;

    public ExpressionSyntaxException(String expression, String path, Throwable cause) {
        super(String.format("invalid expression at '%s': %s (%s)",
                path, expression, cause != null ? cause.getMessage() : "empty expression"), cause);
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
