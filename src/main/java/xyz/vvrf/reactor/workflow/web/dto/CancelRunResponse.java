package xyz.vvrf.reactor.workflow.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class CancelRunResponse {

    @JsonProperty("run_id")
    String runId;

    /**
     * 本次调用是否发出了取消请求；运行已结束或此前已请求过时为 false。
     */
    @JsonProperty("cancel_requested")
    boolean cancelRequested;
}
