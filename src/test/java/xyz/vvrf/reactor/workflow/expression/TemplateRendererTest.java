package xyz.vvrf.reactor.workflow.expression;

import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.reactor.workflow.test.util.TestWorkflows.map;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer(new SpelExpressionEvaluator(Schedulers.boundedElastic()));

    private final Map<String, Object> base = map("run_id", "run-1", "date", "2026-10-18");
    private final Map<String, Object> input = map("name", "Ada", "price", "$5", "items", java.util.Arrays.asList("a", "b"));

    @Test
    void rendersPrefixedPlaceholders() {
        TemplateRenderer.Rendered rendered = renderer.render("Hello {{ input.name }} on {{base.date}}", base, input);

        assertThat(rendered.getText()).isEqualTo("Hello Ada on 2026-10-18");
        assertThat(rendered.getWarnings()).isEmpty();
    }

    @Test
    void barePlaceholderLooksInInputThenBase() {
        TemplateRenderer.Rendered rendered = renderer.render("{{ name }} / {{ run_id }}", base, input);

        assertThat(rendered.getText()).isEqualTo("Ada / run-1");
    }

    @Test
    void unresolvedPlaceholderIsLeftAsIsWithWarning() {
        TemplateRenderer.Rendered rendered = renderer.render("Dear {{ input.missing }},", base, input);

        assertThat(rendered.getText()).isEqualTo("Dear {{ input.missing }},");
        assertThat(rendered.getWarnings()).containsExactly("could not resolve placeholder: {{input.missing}}");
    }

    @Test
    void replacementTextIsNotInterpretedAsGroupReference() {
        assertThat(renderer.render("Costs {{ input.price }}", base, input).getText()).isEqualTo("Costs $5");
    }

    @Test
    void indexedPlaceholderUsesExpressionSyntax() {
        assertThat(renderer.render("First: {{ input.items[0] }}", base, input).getText()).isEqualTo("First: a");
    }

    @Test
    void validateReportsStructuralErrors() {
        assertThat(renderer.validate("x {{}} y").getErrors()).containsExactly("empty placeholder found: {{}}");
        assertThat(renderer.validate("{{ input.items[0 }}").getErrors())
                .containsExactly("unclosed brackets in placeholder: {{input.items[0}}");
        assertThat(renderer.validate("{{ input.name.substring(1 }}").getErrors())
                .containsExactly("unclosed parentheses in placeholder: {{input.name.substring(1}}");
        assertThat(renderer.validate("{{ input.{a} }}").getErrors())
                .containsExactly("malformed placeholder: {{input.{a}}}");
    }

    @Test
    void validateWarnsAboutUnknownRoot() {
        TemplateRenderer.Validation validation = renderer.validate("{{ user.name }} and {{ input.name }}");

        assertThat(validation.isValid()).isTrue();
        assertThat(validation.getPlaceholders()).containsExactly("user.name", "input.name");
        assertThat(validation.getWarnings())
                .containsExactly("unknown root in placeholder: {{user.name}} - should start with 'base.' or 'input.'");
    }

    @Test
    void templateWithoutPlaceholdersIsUnchanged() {
        assertThat(TemplateRenderer.extractPlaceholders("plain text")).isEmpty();
        assertThat(renderer.render("plain text", base, input).getText()).isEqualTo("plain text");
    }
}
