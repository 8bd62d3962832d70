package xyz.vvrf.reactor.workflow.node;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.core.OnErrorPolicy;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.node.metadata.CommonMetadata;
import xyz.vvrf.reactor.workflow.node.metadata.JobMetadata;
import xyz.vvrf.reactor.workflow.node.metadata.ForEachMetadata;
import xyz.vvrf.reactor.workflow.node.metadata.MergeMetadata;
import xyz.vvrf.reactor.workflow.node.metadata.MergeStrategy;
import xyz.vvrf.reactor.workflow.test.util.TestWorkflows;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.vvrf.reactor.workflow.test.util.TestWorkflows.map;

class MetadataBinderTest {

    private final MetadataBinder binder = TestWorkflows.metadataBinder();

    @Test
    void bindsSnakeCaseKeysIncludingCommonFields() {
        JobMetadata job = binder.bind(map(
                "prompt", "hi",
                "model_name", "gpt-test",
                "max_tokens", 64,
                "timeout_ms", 5000,
                "retry", 2,
                "on_error", "continue"), JobMetadata.class);

        assertThat(job.getModelName()).isEqualTo("gpt-test");
        assertThat(job.getMaxTokens()).isEqualTo(64);
        assertThat(job.getTimeoutMs()).isEqualTo(5000L);
        assertThat(job.getRetry()).isEqualTo(2);
        assertThat(job.effectiveOnError()).isEqualTo(OnErrorPolicy.CONTINUE);
    }

    @Test
    void unknownKeyIsRejectedWithItsPath() {
        assertThatThrownBy(() -> binder.bind(map("strategy", "union", "colour", "red"), MergeMetadata.class))
                .isInstanceOf(NodeValidationException.class)
                .hasMessage("colour: unknown key 'colour'");
    }

    @Test
    void firstViolationIsReportedInPathOrder() {
        assertThatThrownBy(() -> binder.bind(map(), JobMetadata.class))
                .isInstanceOf(NodeValidationException.class)
                .extracting(e -> ((NodeValidationException) e).getFieldPath())
                .isEqualTo("model_name");
    }

    @Test
    void invalidOnErrorValueIsRejected() {
        assertThatThrownBy(() -> binder.bind(map("on_error", "retry_forever"), MergeMetadata.class))
                .isInstanceOf(NodeValidationException.class)
                .hasMessageContaining("on_error must be one of fail, skip, continue")
                .extracting(e -> ((NodeValidationException) e).getFieldPath())
                .isEqualTo("on_error");
    }

    @Test
    void negativeRetryIsRejected() {
        assertThatThrownBy(() -> binder.bind(map("retry", -1), MergeMetadata.class))
                .isInstanceOf(NodeValidationException.class)
                .hasMessage("retry: must be greater than or equal to 0");
    }

    @Test
    void lenientBindingIgnoresUnknownKeysAndFallsBackToDefaults() {
        MergeMetadata merge = binder.bindLenient(map("strategy", "concat", "colour", "red"), MergeMetadata.class);
        assertThat(merge.getStrategy()).isEqualTo(MergeStrategy.CONCAT);

        CommonMetadata broken = binder.bindCommon(map("retry", "many"));
        assertThat(broken.getRetry()).isNull();
        assertThat(broken.effectiveOnError()).isEqualTo(OnErrorPolicy.FAIL);

        ForEachMetadata forEach = binder.bindLenient(map("flatten", "sometimes"), ForEachMetadata.class);
        assertThat(forEach.getFlatten()).isTrue();
    }
}
