package xyz.vvrf.reactor.workflow.expression;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.exception.ExpressionEvaluationException;
import xyz.vvrf.reactor.workflow.exception.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 提示词模板渲染：把 {@code {{ base.xxx }}} / {@code {{ input.xxx }}} 占位符替换为表达式求值结果。
 * 无法解析的占位符保持原样并产生一条警告。
 */
@Slf4j
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(.*?)\\s*\\}\\}");
    private static final String BASE_PREFIX = "base.";
    private static final String INPUT_PREFIX = "input.";

    private final ExpressionEvaluator expressionEvaluator;

    public TemplateRenderer(ExpressionEvaluator expressionEvaluator) {
        this.expressionEvaluator = Objects.requireNonNull(expressionEvaluator, "表达式求值器不能为空");
    }

    /**
     * 渲染结果：文本以及未解析占位符的警告。
     */
    @Getter
    public static final class Rendered {
        private final String text;
        private final List<String> warnings;

        Rendered(String text, List<String> warnings) {
            this.text = text;
            this.warnings = Collections.unmodifiableList(warnings);
        }
    }

    /**
     * 模板校验结果：占位符列表、错误和警告。
     */
    @Getter
    public static final class Validation {
        private final List<String> placeholders;
        private final List<String> errors;
        private final List<String> warnings;

        Validation(List<String> placeholders, List<String> errors, List<String> warnings) {
            this.placeholders = Collections.unmodifiableList(placeholders);
            this.errors = Collections.unmodifiableList(errors);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    public static List<String> extractPlaceholders(String template) {
        List<String> placeholders = new ArrayList<>();
        if (template == null) {
            return placeholders;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            placeholders.add(matcher.group(1).trim());
        }
        return placeholders;
    }

    /**
     * 只做静态检查：空占位符、花括号和括号不配对是错误，未知根是警告。
     */
    public Validation validate(String template) {
        List<String> placeholders = extractPlaceholders(template);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (String placeholder : placeholders) {
            if (placeholder.isEmpty()) {
                errors.add("empty placeholder found: {{}}");
                continue;
            }
            if (placeholder.contains("{") || placeholder.contains("}")) {
                errors.add("malformed placeholder: {{" + placeholder + "}}");
                continue;
            }
            if (!placeholder.startsWith(BASE_PREFIX) && !placeholder.startsWith(INPUT_PREFIX)) {
                warnings.add("unknown root in placeholder: {{" + placeholder + "}} - should start with 'base.' or 'input.'");
                continue;
            }
            if (count(placeholder, '[') != count(placeholder, ']')) {
                errors.add("unclosed brackets in placeholder: {{" + placeholder + "}}");
            }
            if (count(placeholder, '(') != count(placeholder, ')')) {
                errors.add("unclosed parentheses in placeholder: {{" + placeholder + "}}");
            }
        }
        return new Validation(placeholders, errors, warnings);
    }

    /**
     * 渲染模板。没有前缀的占位符先在 input 中查找，再在 base 中查找。
     */
    public Rendered render(String template, Map<String, Object> base, Map<String, Object> input) {
        List<String> warnings = new ArrayList<>();
        if (template == null) {
            return new Rendered("", warnings);
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuffer out = new StringBuffer();
        while (matcher.find()) {
            String placeholder = matcher.group(1).trim();
            Object value = resolve(placeholder, base, input);
            String replacement;
            if (value == null) {
                warnings.add("could not resolve placeholder: {{" + placeholder + "}}");
                replacement = matcher.group(0);
            } else {
                replacement = String.valueOf(value);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        if (!warnings.isEmpty()) {
            log.debug("模板渲染存在 {} 个未解析的占位符: {}", warnings.size(), warnings);
        }
        return new Rendered(out.toString(), warnings);
    }

    private Object resolve(String placeholder, Map<String, Object> base, Map<String, Object> input) {
        if (placeholder.startsWith(BASE_PREFIX)) {
            return tryEvaluate(placeholder.substring(BASE_PREFIX.length()), base);
        }
        if (placeholder.startsWith(INPUT_PREFIX)) {
            return tryEvaluate(placeholder.substring(INPUT_PREFIX.length()), input);
        }
        Object value = tryEvaluate(placeholder, input);
        return value != null ? value : tryEvaluate(placeholder, base);
    }

    private Object tryEvaluate(String expression, Map<String, Object> root) {
        if (expression.isEmpty()) {
            return null;
        }
        try {
            return expressionEvaluator.evaluate(expression, ExpressionContext.ofInput(root), "prompt");
        } catch (ExpressionSyntaxException | ExpressionEvaluationException e) {
            log.trace("占位符表达式 '{}' 无法解析: {}", expression, e.getMessage());
            return null;
        }
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
