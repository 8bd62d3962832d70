package xyz.vvrf.reactor.workflow.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class RunCreatedResponse {

    @JsonProperty("run_id")
    String runId;

    @JsonProperty("workflow_id")
    long workflowId;
}
