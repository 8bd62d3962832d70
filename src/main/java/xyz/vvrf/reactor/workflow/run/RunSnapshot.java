package xyz.vvrf.reactor.workflow.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 运行状态在某一时刻的只读视图，用于查询接口。
 */
public final class RunSnapshot {

    private final String runId;
    private final RunKind kind;
    private final Long workflowId;
    private final RunStatus status;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final List<RunEvent> events;

    @JsonCreator
    public RunSnapshot(@JsonProperty("run_id") String runId,
                       @JsonProperty("kind") RunKind kind,
                       @JsonProperty("workflow_id") Long workflowId,
                       @JsonProperty("status") RunStatus status,
                       @JsonProperty("started_at") Instant startedAt,
                       @JsonProperty("finished_at") Instant finishedAt,
                       @JsonProperty("events") List<RunEvent> events) {
        this.runId = Objects.requireNonNull(runId, "运行 ID 不能为空");
        this.kind = kind;
        this.workflowId = workflowId;
        this.status = status;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.events = events == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(events));
    }

    public static RunSnapshot of(RunState state) {
        return new RunSnapshot(
                state.getRunId(),
                state.getKind(),
                state.getWorkflowId().orElse(null),
                state.getStatus(),
                state.getStartedAt(),
                state.getFinishedAt().orElse(null),
                state.getEvents());
    }

    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("kind")
    public RunKind getKind() {
        return kind;
    }

    @JsonProperty("workflow_id")
    public Long getWorkflowId() {
        return workflowId;
    }

    @JsonProperty("status")
    public RunStatus getStatus() {
        return status;
    }

    @JsonProperty("started_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public Instant getStartedAt() {
        return startedAt;
    }

    @JsonProperty("finished_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public Instant getFinishedAt() {
        return finishedAt;
    }

    @JsonProperty("events")
    public List<RunEvent> getEvents() {
        return events;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunSnapshot that = (RunSnapshot) o;
        return runId.equals(that.runId) &&
                kind == that.kind &&
                Objects.equals(workflowId, that.workflowId) &&
                status == that.status &&
                Objects.equals(startedAt, that.startedAt) &&
                Objects.equals(finishedAt, that.finishedAt) &&
                events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, kind, workflowId, status, startedAt, finishedAt, events);
    }

    @Override
    public String toString() {
        return "RunSnapshot{runId='" + runId + "', status=" + status + ", events=" + events.size() + '}';
    }
}
