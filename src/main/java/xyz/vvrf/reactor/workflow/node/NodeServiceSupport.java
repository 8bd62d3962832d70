package xyz.vvrf.reactor.workflow.node;

import lombok.Getter;
import xyz.vvrf.reactor.workflow.expression.ExpressionEvaluator;
import xyz.vvrf.reactor.workflow.expression.TemplateRenderer;

import java.util.Objects;

/**
 * 内置节点实现共用的协作者。
 */
@Getter
public class NodeServiceSupport {

    private final MetadataBinder metadataBinder;
    private final ExpressionEvaluator expressionEvaluator;
    private final TemplateRenderer templateRenderer;

    public NodeServiceSupport(MetadataBinder metadataBinder,
                              ExpressionEvaluator expressionEvaluator,
                              TemplateRenderer templateRenderer) {
        this.metadataBinder = Objects.requireNonNull(metadataBinder, "MetadataBinder 不能为空");
        this.expressionEvaluator = Objects.requireNonNull(expressionEvaluator, "表达式求值器不能为空");
        this.templateRenderer = Objects.requireNonNull(templateRenderer, "模板渲染器不能为空");
    }
}
