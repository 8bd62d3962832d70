package xyz.vvrf.reactor.workflow.expression;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.workflow.exception.ExpressionEvaluationException;
import xyz.vvrf.reactor.workflow.exception.ExpressionSyntaxException;
import xyz.vvrf.reactor.workflow.exception.ExpressionTimeoutException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.vvrf.reactor.workflow.test.util.TestWorkflows.map;

class SpelExpressionEvaluatorTest {

    private final SpelExpressionEvaluator evaluator =
            new SpelExpressionEvaluator(Schedulers.boundedElastic(), Duration.ofSeconds(1), 50);

    private final Map<String, Object> base = map("run_id", "run-1", "date", "2026-10-18");
    private final Map<String, Object> input = map(
            "text", "hello",
            "count", 2,
            "score", 7,
            "user", map("name", "Ada"),
            "items", new ArrayList<>(Arrays.asList(1, 2, 3)));

    private Object eval(String expression) {
        return evaluator.evaluate(expression, ExpressionContext.of(base, input), "test");
    }

    @Nested
    class DataAccess {

        @Test
        void bareNamesReadFromInput() {
            assertThat(eval("text")).isEqualTo("hello");
            assertThat(eval("user.name")).isEqualTo("Ada");
        }

        @Test
        void inputAndBaseVariables() {
            assertThat(eval("#input['count'] + 1")).isEqualTo(3);
            assertThat(eval("#base['run_id']")).isEqualTo("run-1");
        }

        @Test
        void comparisonsAndInstanceMethods() {
            assertThat(eval("score > 5 and text != null")).isEqualTo(true);
            assertThat(eval("text.toUpperCase()")).isEqualTo("HELLO");
            assertThat(eval("items.size()")).isEqualTo(3);
        }

        @Test
        void iterationBindsItemAndIndex() {
            ExpressionContext context = ExpressionContext.of(base, input).withIteration(5, 1);

            assertThat(evaluator.evaluate("#item * 2", context, "test")).isEqualTo(10);
            assertThat(evaluator.evaluate("#index", context, "test")).isEqualTo(1);
        }

        @Test
        void itemIsUnboundOutsideIteration() {
            assertThat(eval("#item")).isNull();
        }
    }

    @Nested
    class Failures {

        @Test
        void syntaxErrorCarriesFieldPath() {
            assertThatThrownBy(() -> evaluator.checkSyntax("text ==", "mapping.summary"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("mapping.summary")
                    .extracting(e -> ((ExpressionSyntaxException) e).getPath())
                    .isEqualTo("mapping.summary");
        }

        @Test
        void blankExpressionIsASyntaxError() {
            assertThatThrownBy(() -> evaluator.checkSyntax("  ", "where"))
                    .isInstanceOf(ExpressionSyntaxException.class);
        }

        @Test
        void missingPropertyIsAnEvaluationError() {
            assertThatThrownBy(() -> eval("missing_key"))
                    .isInstanceOf(ExpressionEvaluationException.class)
                    .hasMessageContaining("missing_key");
        }

        @Test
        void typeReferencesAreNotAllowed() {
            assertThatThrownBy(() -> eval("T(java.lang.Runtime).getRuntime()"))
                    .isInstanceOf(ExpressionEvaluationException.class);
        }

        @Test
        void booleanEvaluationRejectsOtherTypes() {
            assertThatThrownBy(() -> evaluator.evaluateBoolean("text", ExpressionContext.of(base, input), "where"))
                    .isInstanceOf(ExpressionEvaluationException.class)
                    .hasMessageContaining("expected a boolean but got String");
        }

        @Test
        void slowEvaluationTimesOut() {
            Map<String, Object> slowInput = map("slow", new SlowValue(Duration.ofSeconds(2)));

            assertThatThrownBy(() -> evaluator.evaluate("slow.value()", ExpressionContext.ofInput(slowInput),
                    "predicate", Duration.ofMillis(50)))
                    .isInstanceOf(ExpressionTimeoutException.class)
                    .hasMessageContaining("timed out after 50ms")
                    .extracting(e -> ((ExpressionTimeoutException) e).getTimeout())
                    .isEqualTo(Duration.ofMillis(50));
        }
    }

    public static class SlowValue {
        private final Duration delay;

        SlowValue(Duration delay) {
            this.delay = delay;
        }

        public String value() {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }
    }
}
