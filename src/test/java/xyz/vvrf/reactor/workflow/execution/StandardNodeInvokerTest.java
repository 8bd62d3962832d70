package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.util.retry.Retry;
import xyz.vvrf.reactor.workflow.core.*;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.exception.NodeServiceNotFoundException;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.monitor.RunMonitorListener;
import xyz.vvrf.reactor.workflow.registry.SimpleNodeServiceRegistry;
import xyz.vvrf.reactor.workflow.test.util.TestNodeService;
import xyz.vvrf.reactor.workflow.test.util.TestWorkflows;

import java.time.Duration;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static xyz.vvrf.reactor.workflow.test.util.TestWorkflows.map;
import static xyz.vvrf.reactor.workflow.test.util.TestWorkflows.node;

@ExtendWith(MockitoExtension.class)
class StandardNodeInvokerTest {

    private static final RunScope SCOPE = new RunScope("run-1", 7L, 0, Collections.emptyMap(), null);

    @Mock
    private RunMonitorListener listener;

    private final SimpleNodeServiceRegistry registry = new SimpleNodeServiceRegistry();
    private final Scheduler scheduler = Schedulers.newBoundedElastic(4, 100, "test-node-exec");

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private StandardNodeInvoker invoker() {
        return new StandardNodeInvoker(registry, TestWorkflows.metadataBinder(), Duration.ofSeconds(2), scheduler,
                Retry.backoff(1, Duration.ofMillis(1)), Collections.singletonList(listener));
    }

    private static NodeInput input() {
        return NodeInput.of(map("text", "hi"), SCOPE);
    }

    @Test
    void successfulExecutionNotifiesListener() {
        registry.register(TestNodeService.builder(NodeType.MAP).returnsOutput(map("ok", true)).build());
        WorkflowNode node = node(1L, NodeType.MAP);

        StepVerifier.create(invoker().invoke(node, input()))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isTrue();
                    assertThat(result.getOutput()).containsEntry("ok", true);
                })
                .verifyComplete();

        verify(listener).onNodeStart("run-1", 7L, node);
        verify(listener).onNodeSuccess(eq("run-1"), eq(7L), eq(node), any(Duration.class), any(NodeResult.class));
    }

    @Test
    void timeoutBecomesNodeExecutionFailure() {
        registry.register(TestNodeService.builder(NodeType.MAP)
                .sleepsThenReturns(Duration.ofMillis(500), map("late", true))
                .build());
        WorkflowNode node = node(1L, NodeType.MAP, "timeout_ms", 50);

        StepVerifier.create(invoker().invoke(node, input()))
                .assertNext(result -> {
                    assertThat(result.isFailure()).isTrue();
                    assertThat(result.getError()).get()
                            .isInstanceOf(NodeExecutionException.class)
                            .extracting(Throwable::getMessage)
                            .isEqualTo("execution timed out after 50ms");
                })
                .verifyComplete();

        verify(listener).onNodeTimeout("run-1", 7L, node, Duration.ofMillis(50));
        verify(listener).onNodeFailure(eq("run-1"), eq(7L), eq(node), any(Duration.class), any(NodeExecutionException.class));
    }

    @Test
    void typeTimeoutAppliesWhenNodeHasNone() {
        registry.register(TestNodeService.builder(NodeType.MAP)
                .sleepsThenReturns(Duration.ofMillis(500), map())
                .executionTimeout(Duration.ofMillis(40))
                .build());

        StepVerifier.create(invoker().invoke(node(1L, NodeType.MAP), input()))
                .assertNext(result -> assertThat(result.getError()).get()
                        .extracting(Throwable::getMessage)
                        .isEqualTo("execution timed out after 40ms"))
                .verifyComplete();
    }

    @Test
    void retriesUntilSuccess() {
        TestNodeService service = TestNodeService.builder(NodeType.MAP)
                .failsTimesThenReturns(2, new IllegalStateException("flaky"), map("ok", true))
                .build();
        registry.register(service);

        StepVerifier.create(invoker().invoke(node(1L, NodeType.MAP, "retry", 2), input()))
                .assertNext(result -> assertThat(result.isSuccess()).isTrue())
                .verifyComplete();

        assertThat(service.getInvocations()).isEqualTo(3);
    }

    @Test
    void exhaustedRetriesSurfaceOriginalError() {
        TestNodeService service = TestNodeService.builder(NodeType.MAP)
                .failsWith(new IllegalStateException("always"))
                .build();
        registry.register(service);

        StepVerifier.create(invoker().invoke(node(1L, NodeType.MAP, "retry", 1), input()))
                .assertNext(result -> assertThat(result.getError()).get()
                        .isInstanceOf(IllegalStateException.class)
                        .extracting(Throwable::getMessage)
                        .isEqualTo("always"))
                .verifyComplete();

        assertThat(service.getInvocations()).isEqualTo(2);
    }

    @Test
    void validationErrorsAreNotRetried() {
        TestNodeService service = TestNodeService.builder(NodeType.MAP)
                .failsWith(new NodeValidationException("fields", "must not be empty"))
                .build();
        registry.register(service);

        StepVerifier.create(invoker().invoke(node(1L, NodeType.MAP, "retry", 3), input()))
                .assertNext(result -> assertThat(result.getError()).get().isInstanceOf(NodeValidationException.class))
                .verifyComplete();

        assertThat(service.getInvocations()).isEqualTo(1);
    }

    @Test
    void missingServiceIsReportedAsFailure() {
        WorkflowNode node = node(1L, NodeType.JOB);

        StepVerifier.create(invoker().invoke(node, input()))
                .assertNext(result -> assertThat(result.getError()).get().isInstanceOf(NodeServiceNotFoundException.class))
                .verifyComplete();

        verify(listener).onNodeFailure(eq("run-1"), eq(7L), eq(node), eq(Duration.ZERO), any(NodeServiceNotFoundException.class));
        verify(listener, never()).onNodeStart(anyString(), anyLong(), any());
    }

    @Test
    void failingListenerDoesNotBreakExecution() {
        registry.register(TestNodeService.builder(NodeType.MAP).returnsOutput(map("ok", 1)).build());
        doThrow(new IllegalStateException("listener down")).when(listener).onNodeStart(anyString(), anyLong(), any());

        StepVerifier.create(invoker().invoke(node(1L, NodeType.MAP), input()))
                .assertNext(result -> assertThat(result.isSuccess()).isTrue())
                .verifyComplete();
    }
}
