package xyz.vvrf.reactor.workflow.run;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class RunEventStreamTest {

    private final RunRegistry registry = new RunRegistry(Duration.ofMinutes(15), 100, Clock.systemUTC());
    private final Scheduler scheduler = Schedulers.newBoundedElastic(2, 100, "test-run-stream");
    private final RunEventStream stream = new RunEventStream(registry, Duration.ofMillis(50), scheduler);

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private static RunEvent event(String message) {
        return RunEvent.info(Instant.now(), message, Collections.emptyMap());
    }

    @Test
    void finishedRunDrainsBacklogThenSignalsDone() {
        String runId = registry.create(RunKind.WORKFLOW, 1L).getRunId();
        registry.append(runId, event("node_start"));
        registry.append(runId, event("node_output"));
        registry.finish(runId, RunStatus.SUCCEEDED);

        StepVerifier.create(stream.stream(runId))
                .assertNext(signal -> assertThat(signal.getEvent()).map(RunEvent::getMessage).contains("node_start"))
                .assertNext(signal -> assertThat(signal.getEvent()).map(RunEvent::getMessage).contains("node_output"))
                .assertNext(signal -> assertThat(signal.getType()).isEqualTo(RunSignal.Type.DONE))
                .verifyComplete();
    }

    @Test
    void unknownRunSignalsDoneImmediately() {
        StepVerifier.create(stream.stream("missing"))
                .assertNext(signal -> assertThat(signal.getType()).isEqualTo(RunSignal.Type.DONE))
                .verifyComplete();
    }

    @Test
    void idleRunProducesHeartbeats() {
        String runId = registry.create(RunKind.WORKFLOW, 1L).getRunId();

        StepVerifier.create(stream.stream(runId))
                .assertNext(signal -> assertThat(signal.getType()).isEqualTo(RunSignal.Type.HEARTBEAT))
                .then(() -> {
                    registry.append(runId, event("late"));
                    registry.finish(runId, RunStatus.FAILED);
                })
                .thenConsumeWhile(signal -> signal.getType() == RunSignal.Type.HEARTBEAT)
                .assertNext(signal -> assertThat(signal.getEvent()).map(RunEvent::getMessage).contains("late"))
                .assertNext(signal -> assertThat(signal.getType()).isEqualTo(RunSignal.Type.DONE))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }
}
