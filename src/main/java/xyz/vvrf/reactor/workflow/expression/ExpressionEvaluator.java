package xyz.vvrf.reactor.workflow.expression;

import java.time.Duration;

/**
 * 节点配置中使用的数据选择/变换表达式的求值器。
 * 所有方法都带上出错字段的点分路径，便于界面定位具体字段。
 */
public interface ExpressionEvaluator {

    /**
     * 只做语法检查，不执行表达式。
     *
     * @throws xyz.vvrf.reactor.workflow.exception.ExpressionSyntaxException 表达式为空或无法解析
     */
    void checkSyntax(String expression, String path);

    /**
     * 使用默认超时求值。
     *
     * @throws xyz.vvrf.reactor.workflow.exception.ExpressionEvaluationException 求值失败或超时
     */
    Object evaluate(String expression, ExpressionContext context, String path);

    /**
     * 使用指定超时求值，调用方最多等待 timeout。
     */
    Object evaluate(String expression, ExpressionContext context, String path, Duration timeout);

    /**
     * 对谓词求值，结果必须是布尔值。
     */
    boolean evaluateBoolean(String expression, ExpressionContext context, String path);

    /**
     * 判断一个值是否可以按表达式处理：非空字符串即为表达式，其它类型视为字面量。
     */
    default boolean isExpression(Object value) {
        return value instanceof String && !((String) value).trim().isEmpty();
    }
}
