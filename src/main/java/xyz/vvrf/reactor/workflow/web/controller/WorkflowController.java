package xyz.vvrf.reactor.workflow.web.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.DagValidationResult;
import xyz.vvrf.reactor.workflow.core.PlannedNode;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.run.RunEvent;
import xyz.vvrf.reactor.workflow.run.RunSignal;
import xyz.vvrf.reactor.workflow.run.RunSnapshot;
import xyz.vvrf.reactor.workflow.service.WorkflowOperations;
import xyz.vvrf.reactor.workflow.web.dto.CancelRunResponse;
import xyz.vvrf.reactor.workflow.web.dto.NodeValidationResponse;
import xyz.vvrf.reactor.workflow.web.dto.RunCreatedResponse;
import xyz.vvrf.reactor.workflow.web.dto.StartingInputsRequest;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link WorkflowOperations} 的 HTTP 适配层。
 * 运行事件以 SSE 推送：每条事件一个 {@code log}，等待超时时一个 {@code heartbeat}，运行结束后一个 {@code done}。
 */
@Slf4j
@RestController
public class WorkflowController {

    static final String EVENT_LOG = "log";
    static final String EVENT_HEARTBEAT = "heartbeat";
    static final String EVENT_DONE = "done";

    private final WorkflowOperations operations;
    private final ObjectMapper objectMapper;

    public WorkflowController(WorkflowOperations operations, ObjectMapper objectMapper) {
        this.operations = operations;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/workflows/{workflowId}/dag/validate")
    public Mono<DagValidationResult> validateDag(@PathVariable long workflowId) {
        return Mono.fromCallable(() -> operations.validateDag(workflowId));
    }

    @PostMapping("/workflows/{workflowId}/plan")
    public Mono<List<PlannedNode>> planWorkflow(@PathVariable long workflowId,
                                                @RequestBody(required = false) StartingInputsRequest request) {
        return Mono.fromCallable(() -> operations.planWorkflow(workflowId, startingInputs(request)));
    }

    @GetMapping("/workflows/{workflowId}/available-data")
    public Mono<Map<Long, Map<String, Object>>> availableData(@PathVariable long workflowId) {
        return Mono.fromCallable(() -> operations.availableDataMap(workflowId));
    }

    @PostMapping("/nodes/validate")
    public Mono<NodeValidationResponse> validateNode(@RequestBody WorkflowNode node) {
        return Mono.fromCallable(() -> {
            operations.validateNode(node);
            return new NodeValidationResponse(node.getId(), true);
        });
    }

    @PostMapping("/workflows/{workflowId}/runs")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<RunCreatedResponse> runWorkflow(@PathVariable long workflowId,
                                                @RequestBody(required = false) StartingInputsRequest request) {
        return Mono.fromCallable(() -> new RunCreatedResponse(
                operations.runWorkflow(workflowId, startingInputs(request)), workflowId));
    }

    @GetMapping("/runs/{runId}")
    public Mono<RunSnapshot> getRun(@PathVariable String runId) {
        return Mono.fromCallable(() -> operations.getRun(runId));
    }

    @PostMapping("/runs/{runId}/cancel")
    public Mono<CancelRunResponse> cancelRun(@PathVariable String runId) {
        return Mono.fromCallable(() -> new CancelRunResponse(runId, operations.cancelRun(runId)));
    }

    @GetMapping(value = "/runs/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> streamRun(@PathVariable String runId) {
        return Flux.defer(() -> operations.streamRun(runId))
                .map(signal -> toServerSentEvent(runId, signal));
    }

    private ServerSentEvent<String> toServerSentEvent(String runId, RunSignal signal) {
        switch (signal.getType()) {
            case EVENT:
                RunEvent event = signal.getEvent().orElseThrow(IllegalStateException::new);
                try {
                    return ServerSentEvent.<String>builder()
                            .id(UUID.randomUUID().toString())
                            .event(EVENT_LOG)
                            .data(objectMapper.writeValueAsString(event))
                            .build();
                } catch (JsonProcessingException e) {
                    log.error("[RunId: {}] 事件序列化失败: {}", runId, e.getMessage(), e);
                    return ServerSentEvent.<String>builder()
                            .id(UUID.randomUUID().toString())
                            .event("serialization_error")
                            .data("{\"error\":\"failed to serialize run event\",\"run_id\":\"" + runId + "\"}")
                            .build();
                }
            case HEARTBEAT:
                return ServerSentEvent.<String>builder()
                        .event(EVENT_HEARTBEAT)
                        .comment("keep-alive")
                        .build();
            case DONE:
            default:
                return ServerSentEvent.<String>builder()
                        .event(EVENT_DONE)
                        .data("{\"run_id\":\"" + runId + "\"}")
                        .build();
        }
    }

    private static Map<String, Object> startingInputs(StartingInputsRequest request) {
        if (request == null || request.getStartingInputs() == null) {
            return Collections.emptyMap();
        }
        return request.getStartingInputs();
    }
}
