package xyz.vvrf.reactor.workflow.node;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeService;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.exception.ExpressionSyntaxException;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.expression.ExpressionContext;
import xyz.vvrf.reactor.workflow.expression.TemplateRenderer;
import xyz.vvrf.reactor.workflow.node.metadata.CommonMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 内置节点实现的基类：把松散的 metadata 绑定到类型化的 {@code M}，
 * 统一处理 structured_output 校验、未知 key 和表达式语法检查。
 *
 * @param <M> 该节点类型的 metadata 类
 */
@Slf4j
public abstract class AbstractNodeService<M extends CommonMetadata> implements NodeService {

    private final NodeType nodeType;
    private final Class<M> metadataType;
    protected final NodeServiceSupport support;

    protected AbstractNodeService(NodeType nodeType, Class<M> metadataType, NodeServiceSupport support) {
        this.nodeType = Objects.requireNonNull(nodeType, "节点类型不能为空");
        this.metadataType = Objects.requireNonNull(metadataType, "metadata 类型不能为空");
        this.support = Objects.requireNonNull(support, "NodeServiceSupport 不能为空");
    }

    @Override
    public final NodeType nodeType() {
        return nodeType;
    }

    @Override
    public final void validate(Map<String, Object> metadata, Map<String, Object> structuredOutput) {
        Shapes.validateStructuredOutput(structuredOutput);
        M bound = support.getMetadataBinder().bind(metadata, metadataType);
        validateMetadata(bound);
    }

    @Override
    public final Map<String, Object> plan(Map<String, Object> metadata,
                                          Map<String, Object> inputShape,
                                          Map<String, Object> structuredOutput) {
        M bound = support.getMetadataBinder().bindLenient(metadata, metadataType);
        return planShape(bound, inputShape == null ? new LinkedHashMap<>() : inputShape);
    }

    @Override
    public final Map<String, Object> execute(NodeInput input, Map<String, Object> metadata) {
        M bound = support.getMetadataBinder().bind(metadata, metadataType);
        return executeNode(input, bound);
    }

    /**
     * 类型相关的额外校验（表达式语法、跨字段规则等），绑定和约束校验已经通过。
     */
    protected void validateMetadata(M metadata) {
    }

    protected abstract Map<String, Object> planShape(M metadata, Map<String, Object> inputShape);

    protected abstract Map<String, Object> executeNode(NodeInput input, M metadata);

    // --- 子类使用的辅助方法 ---

    /**
     * 语法检查一个表达式字段，失败时转换为带字段路径的 {@link NodeValidationException}。
     */
    protected void checkExpression(String expression, String fieldPath) {
        try {
            support.getExpressionEvaluator().checkSyntax(expression, fieldPath);
        } catch (ExpressionSyntaxException e) {
            throw new NodeValidationException(fieldPath, "invalid expression: " + expression, e);
        }
    }

    /**
     * 可选的表达式字段：为空时跳过。
     */
    protected void checkOptionalExpression(String expression, String fieldPath) {
        if (expression != null) {
            checkExpression(expression, fieldPath);
        }
    }

    /**
     * 检查 key -> 表达式 映射中的每个值。
     */
    protected void checkExpressionMap(Map<String, String> expressions, String fieldPath) {
        if (expressions == null) {
            return;
        }
        expressions.forEach((key, expression) -> checkExpression(expression, fieldPath + "." + key));
    }

    /**
     * 校验提示词/查询模板的占位符。
     */
    protected void checkTemplate(String template, String fieldPath) {
        TemplateRenderer.Validation validation = support.getTemplateRenderer().validate(template);
        if (!validation.isValid()) {
            throw new NodeValidationException(fieldPath, validation.getErrors().get(0));
        }
        if (!validation.getWarnings().isEmpty()) {
            log.debug("字段 '{}' 的模板存在警告: {}", fieldPath, validation.getWarnings());
        }
    }

    protected Object evaluate(String expression, NodeInput input, String fieldPath) {
        return support.getExpressionEvaluator().evaluate(expression, ExpressionContext.from(input), fieldPath);
    }

    protected boolean evaluateBoolean(String expression, ExpressionContext context, String fieldPath) {
        return support.getExpressionEvaluator().evaluateBoolean(expression, context, fieldPath);
    }

    /**
     * 渲染模板，未解析的占位符只记录日志。
     */
    protected String render(String template, NodeInput input, String fieldPath) {
        TemplateRenderer.Rendered rendered = support.getTemplateRenderer()
                .render(template, input.getScope().getBase(), input.getData());
        if (!rendered.getWarnings().isEmpty()) {
            log.warn("[RunId: {}] 节点类型 '{}' 字段 '{}' 渲染时存在未解析的占位符: {}",
                    input.getScope().getRunId(), nodeType, fieldPath, rendered.getWarnings());
        }
        return rendered.getText();
    }

    /**
     * 对 key -> 表达式 映射逐个求值。
     */
    protected Map<String, Object> evaluateMap(Map<String, String> expressions, NodeInput input, String fieldPath) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (expressions != null) {
            expressions.forEach((key, expression) -> values.put(key, evaluate(expression, input, fieldPath + "." + key)));
        }
        return values;
    }

    protected static Map<String, Object> shape(Object... keyValues) {
        Map<String, Object> shape = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            shape.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return shape;
    }

    protected static boolean isCollection(Object value) {
        return value instanceof Collection;
    }
}
