package xyz.vvrf.reactor.workflow.run;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunRegistryTest {

    private static final Instant T0 = Instant.parse("2026-10-18T08:00:00Z");
    private static final Duration TTL = Duration.ofSeconds(900);

    private final RunRegistry registry = new RunRegistry(TTL, 3, Clock.fixed(T0, ZoneOffset.UTC));

    private static RunEvent event(String message) {
        return RunEvent.info(T0, message, Collections.emptyMap());
    }

    @Test
    void newRunStartsCreatedWithUniqueId() {
        RunState first = registry.create(RunKind.WORKFLOW, 1L);
        RunState second = registry.create(RunKind.EXPERT);

        assertThat(first.getRunId()).isNotEqualTo(second.getRunId());
        assertThat(first.getStatus()).isEqualTo(RunStatus.CREATED);
        assertThat(first.getStartedAt()).isEqualTo(T0);
        assertThat(first.getWorkflowId()).contains(1L);
        assertThat(second.getWorkflowId()).isEmpty();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void eventsArePoppedInAppendOrder() {
        String runId = registry.create(RunKind.WORKFLOW, 1L).getRunId();
        registry.append(runId, event("a"));
        registry.append(runId, event("b"));

        assertThat(registry.popNext(runId, Duration.ZERO)).map(RunEvent::getMessage).contains("a");
        assertThat(registry.popNext(runId, Duration.ZERO)).map(RunEvent::getMessage).contains("b");
        assertThat(registry.popNext(runId, Duration.ofMillis(10))).isEmpty();
        assertThat(registry.get(runId).get().getEvents()).extracting(RunEvent::getMessage).containsExactly("a", "b");
    }

    @Test
    void fullChannelKeepsEventInLogOnly() {
        String runId = registry.create(RunKind.WORKFLOW, 1L).getRunId();
        for (int i = 0; i < 5; i++) {
            assertThat(registry.append(runId, event("e" + i))).isTrue();
        }

        RunState state = registry.get(runId).get();
        assertThat(state.getEvents()).hasSize(5);
        assertThat(state.getPendingCount()).isEqualTo(3);
    }

    @Test
    void appendToUnknownRunIsDropped() {
        assertThat(registry.append("nope", event("a"))).isFalse();
        assertThat(registry.popNext("nope", Duration.ZERO)).isEmpty();
    }

    @Test
    void finishIsTerminalAndOnlyOnce() {
        String runId = registry.create(RunKind.WORKFLOW, 1L).getRunId();
        registry.markRunning(runId);
        assertThat(registry.get(runId).get().getStatus()).isEqualTo(RunStatus.RUNNING);

        assertThat(registry.finish(runId, RunStatus.SUCCEEDED)).isTrue();
        assertThat(registry.finish(runId, RunStatus.FAILED)).isFalse();

        RunState state = registry.get(runId).get();
        assertThat(state.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(state.getFinishedAt()).contains(T0);
        assertThatThrownBy(() -> registry.finish(runId, RunStatus.RUNNING))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelOnlyAffectsUnfinishedRunsOnce() {
        String runId = registry.create(RunKind.WORKFLOW, 1L).getRunId();

        assertThat(registry.cancel(runId)).isTrue();
        assertThat(registry.cancel(runId)).isFalse();
        assertThat(registry.get(runId).get().isCancelRequested()).isTrue();

        String finished = registry.create(RunKind.WORKFLOW, 1L).getRunId();
        registry.finish(finished, RunStatus.SUCCEEDED);
        assertThat(registry.cancel(finished)).isFalse();
        assertThat(registry.cancel("unknown")).isFalse();
    }

    @Test
    void evictionRemovesOnlyRunsPastTheirTtl() {
        String finished = registry.create(RunKind.WORKFLOW, 1L).getRunId();
        registry.finish(finished, RunStatus.SUCCEEDED);
        String abandoned = registry.create(RunKind.WORKFLOW, 2L).getRunId();

        assertThat(registry.evictExpired(T0.plus(TTL))).isZero();
        assertThat(registry.size()).isEqualTo(2);

        assertThat(registry.evictExpired(T0.plus(TTL).plusSeconds(1))).isEqualTo(2);
        assertThat(registry.get(finished)).isEmpty();
        assertThat(registry.get(abandoned)).isEmpty();
    }

    @Test
    void evictionStartsFromFinishTime() {
        MutableClock clock = new MutableClock(T0);
        RunRegistry mutable = new RunRegistry(TTL, 10, clock);
        String runId = mutable.create(RunKind.WORKFLOW, 1L).getRunId();
        clock.advance(Duration.ofSeconds(600));
        mutable.finish(runId, RunStatus.FAILED);

        // 开始后已超过 TTL，但结束后还没有
        assertThat(mutable.evictExpired(T0.plusSeconds(1000))).isZero();
        assertThat(mutable.evictExpired(T0.plusSeconds(1501))).isEqualTo(1);
    }

    @Test
    void channelCapacityMustBePositive() {
        assertThatThrownBy(() -> new RunRegistry(TTL, 0, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
