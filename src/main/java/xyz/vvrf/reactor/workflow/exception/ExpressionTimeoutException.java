package xyz.vvrf.reactor.workflow.exception;

import java.time.Duration;

/**
 * 表达式求值超过了允许的时间。
 */
public class ExpressionTimeoutException extends ExpressionEvaluationException {

    private final Duration timeout;

    public ExpressionTimeoutException(String expression, String path, Duration timeout, Throwable cause) {
        super(expression, path, "timed out after " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
