package xyz.vvrf.reactor.workflow.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.util.retry.Retry;
import xyz.vvrf.reactor.workflow.core.DagValidationResult;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.core.PlannedNode;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.exception.RunNotFoundException;
import xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException;
import xyz.vvrf.reactor.workflow.execution.StandardNodeInvoker;
import xyz.vvrf.reactor.workflow.execution.StandardWorkflowExecutor;
import xyz.vvrf.reactor.workflow.node.client.CompletionClient;
import xyz.vvrf.reactor.workflow.node.client.CompletionRequest;
import xyz.vvrf.reactor.workflow.node.client.HttpResourceClient;
import xyz.vvrf.reactor.workflow.planning.AvailableDataResolver;
import xyz.vvrf.reactor.workflow.planning.ShapePlanner;
import xyz.vvrf.reactor.workflow.registry.SimpleNodeServiceRegistry;
import xyz.vvrf.reactor.workflow.repository.InMemoryWorkflowRepository;
import xyz.vvrf.reactor.workflow.run.*;
import xyz.vvrf.reactor.workflow.test.util.TestWorkflows;
import xyz.vvrf.reactor.workflow.validation.DagValidator;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static xyz.vvrf.reactor.workflow.test.util.TestWorkflows.map;

@ExtendWith(MockitoExtension.class)
class WorkflowOperationsTest {

    @Mock
    private CompletionClient completionClient;

    private final Scheduler scheduler = Schedulers.newBoundedElastic(8, 100, "test-operations");
    private final InMemoryWorkflowRepository repository = new InMemoryWorkflowRepository();
    private final RunRegistry runRegistry = new RunRegistry(Duration.ofMinutes(15), 100, Clock.systemUTC());
    private WorkflowOperations operations;

    @BeforeEach
    void setUp() {
        SimpleNodeServiceRegistry registry = new SimpleNodeServiceRegistry(TestWorkflows.builtInServices(
                TestWorkflows.nodeServiceSupport(), completionClient, mock(HttpResourceClient.class)));
        DagValidator validator = new DagValidator();
        ShapePlanner planner = new ShapePlanner(registry, validator);
        AvailableDataResolver resolver = new AvailableDataResolver(planner);
        StandardNodeInvoker invoker = new StandardNodeInvoker(registry, TestWorkflows.metadataBinder(),
                Duration.ofSeconds(5), scheduler, Retry.backoff(1, Duration.ofMillis(1)), Collections.emptyList());
        StandardWorkflowExecutor executor = new StandardWorkflowExecutor(validator, resolver, invoker,
                TestWorkflows.metadataBinder(), runRegistry, repository, scheduler, Clock.systemUTC(), 8,
                Collections.emptyList());
        operations = new WorkflowOperations(repository, registry, validator, planner, resolver, executor, runRegistry,
                new RunEventStream(runRegistry, Duration.ofMillis(50), scheduler));

        store(TestWorkflows.workflow(1)
                .node(1, NodeType.JOB, "prompt", "Summarize {{ input.topic }}", "model_name", "gpt-test")
                .node(2, NodeType.FILTER, "where", "text != null")
                .node(3, NodeType.MAP, "mapping", map("summary", "text", "count", 1))
                .node(4, NodeType.MERGE)
                .edge(1, 2)
                .edge(1, 3)
                .edge(2, 4)
                .edge(3, 4));
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private void store(TestWorkflows.Builder builder) {
        repository.saveWorkflow(builder.trigger(null, false).workflowRecord());
        builder.nodes().forEach(repository::saveNode);
        builder.edges().forEach(edge -> repository.saveEdge(builder.workflowRecord().getId(), edge));
    }

    @Test
    void validateDagReportsMissingTrigger() {
        DagValidationResult result = operations.validateDag(1);

        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).containsExactly("no trigger configured");
        assertThat(result.getTopoOrder()).containsExactly(1L, 2L, 3L, 4L);
    }

    @Test
    void unknownWorkflowIsRejected() {
        assertThatThrownBy(() -> operations.validateDag(99)).isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> operations.runWorkflow(99, null)).isInstanceOf(WorkflowNotFoundException.class);
    }

    @Test
    void planAndAvailableDataCoverEveryNode() {
        List<PlannedNode> planned = operations.planWorkflow(1, map("topic", "cats"));
        Map<Long, Map<String, Object>> available = operations.availableDataMap(1);

        assertThat(planned).extracting(PlannedNode::getNodeId).containsExactly(1L, 2L, 3L, 4L);
        assertThat(available).containsOnlyKeys(1L, 2L, 3L, 4L);
    }

    @Test
    void planningAnInvalidGraphFails() {
        store(TestWorkflows.workflow(2)
                .node(10, NodeType.MAP, "mapping", map("a", 1))
                .node(11, NodeType.MAP, "mapping", map("b", 2))
                .edge(10, 11)
                .edge(11, 10));

        assertThatThrownBy(() -> operations.planWorkflow(2, null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void validateNodeSurfacesFieldErrors() {
        assertThatThrownBy(() -> operations.validateNode(TestWorkflows.node(5, NodeType.MAP, "mapping", map())))
                .isInstanceOf(NodeValidationException.class)
                .hasMessageContaining("mapping");
    }

    @Test
    void runIsStreamedUntilDone() {
        when(completionClient.complete(any(CompletionRequest.class))).thenReturn("a summary");

        String runId = operations.runWorkflow(1, map("topic", "cats"));

        StepVerifier.create(operations.streamRun(runId)
                        .filter(signal -> signal.getType() == RunSignal.Type.EVENT)
                        .count())
                .expectNext(9L)
                .expectComplete()
                .verify(Duration.ofSeconds(10));
        RunSnapshot snapshot = operations.getRun(runId);
        assertThat(snapshot.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(snapshot.getWorkflowId()).isEqualTo(1L);
        assertThat(snapshot.getEvents()).hasSize(9);
        assertThat(operations.cancelRun(runId)).isFalse();
    }

    @Test
    void unknownRunsAreReported() {
        assertThatThrownBy(() -> operations.getRun("missing")).isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> operations.streamRun("missing")).isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> operations.cancelRun("missing")).isInstanceOf(RunNotFoundException.class);
    }
}
