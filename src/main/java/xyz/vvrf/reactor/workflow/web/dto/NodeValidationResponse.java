package xyz.vvrf.reactor.workflow.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class NodeValidationResponse {

    @JsonProperty("node_id")
    long nodeId;

    @JsonProperty("valid")
    boolean valid;
}
