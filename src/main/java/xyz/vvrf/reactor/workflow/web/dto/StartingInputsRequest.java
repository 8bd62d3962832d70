package xyz.vvrf.reactor.workflow.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 规划和启动运行的请求体。
 */
@Data
@NoArgsConstructor
public class StartingInputsRequest {

    @JsonProperty("starting_inputs")
    private Map<String, Object> startingInputs = new LinkedHashMap<>();
}
