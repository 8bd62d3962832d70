package xyz.vvrf.reactor.workflow.expression;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.workflow.exception.ExpressionEvaluationException;
import xyz.vvrf.reactor.workflow.exception.ExpressionSyntaxException;
import xyz.vvrf.reactor.workflow.exception.ExpressionTimeoutException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring Expression Language 的 {@link ExpressionEvaluator} 实现。
 * <p>
 * 求值使用 {@link SimpleEvaluationContext}：只读数据绑定、Map 属性访问和实例方法调用，
 * 不支持类型引用、构造器和 Bean 引用。解析结果按表达式文本缓存在 Caffeine 中。
 * 求值在表达式调度器上进行，调用方最多等待超时时间；超时后后台求值不会被中断，只是结果被丢弃。
 */
@Slf4j
public class SpelExpressionEvaluator implements ExpressionEvaluator {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(100);

    private final SpelExpressionParser parser = new SpelExpressionParser();
    private final Cache<String, Expression> expressionCache;
    private final Scheduler expressionScheduler;
    private final Duration defaultTimeout;

    public SpelExpressionEvaluator(Scheduler expressionScheduler, Duration defaultTimeout, long cacheSize) {
        this.expressionScheduler = Objects.requireNonNull(expressionScheduler, "表达式调度器不能为空");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "默认超时不能为空");
        this.expressionCache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .build();
        log.info("SpelExpressionEvaluator 初始化完成。默认超时: {}, 缓存大小: {}", defaultTimeout, cacheSize);
    }

    public SpelExpressionEvaluator(Scheduler expressionScheduler) {
        this(expressionScheduler, DEFAULT_TIMEOUT, 1000);
    }

    @Override
    public void checkSyntax(String expression, String path) {
        parse(expression, path);
    }

    @Override
    public Object evaluate(String expression, ExpressionContext context, String path) {
        return evaluate(expression, context, path, defaultTimeout);
    }

    @Override
    public Object evaluate(String expression, ExpressionContext context, String path, Duration timeout) {
        Expression parsed = parse(expression, path);
        EvaluationContext evaluationContext = buildEvaluationContext(context);
        try {
            return Mono.fromCallable(() -> parsed.getValue(evaluationContext))
                    .subscribeOn(expressionScheduler)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                log.warn("表达式 '{}' (字段: {}) 在 {} 内未完成求值", expression, path, timeout);
                throw new ExpressionTimeoutException(expression, path, timeout, cause);
            }
            if (cause instanceof EvaluationException) {
                log.debug("表达式 '{}' (字段: {}) 求值失败: {}", expression, path, cause.getMessage());
                throw new ExpressionEvaluationException(expression, path, cause.getMessage(), cause);
            }
            log.warn("表达式 '{}' (字段: {}) 求值时发生意外错误", expression, path, cause);
            throw new ExpressionEvaluationException(expression, path, String.valueOf(cause.getMessage()), cause);
        }
    }

    @Override
    public boolean evaluateBoolean(String expression, ExpressionContext context, String path) {
        Object value = evaluate(expression, context, path);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new ExpressionEvaluationException(expression, path,
                "expected a boolean but got " + (value == null ? "null" : value.getClass().getSimpleName()), null);
    }

    private Expression parse(String expression, String path) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new ExpressionSyntaxException(expression, path, null);
        }
        try {
            return expressionCache.get(expression, parser::parseExpression);
        } catch (ParseException e) {
            throw new ExpressionSyntaxException(expression, path, e);
        }
    }

    private EvaluationContext buildEvaluationContext(ExpressionContext context) {
        SimpleEvaluationContext evaluationContext = SimpleEvaluationContext
                .forPropertyAccessors(new MapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
                .withInstanceMethods()
                .withRootObject(context.getInput())
                .build();
        evaluationContext.setVariable("base", context.getBase());
        evaluationContext.setVariable("input", context.getInput());
        if (context.isIteration()) {
            evaluationContext.setVariable("item", context.getItem());
            evaluationContext.setVariable("index", context.getIndex());
        }
        return evaluationContext;
    }
}
