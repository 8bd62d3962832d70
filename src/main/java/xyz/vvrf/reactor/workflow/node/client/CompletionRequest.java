package xyz.vvrf.reactor.workflow.node.client;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 一次模型补全请求，prompt 已经渲染完成。
 */
@Value
@Builder
public class CompletionRequest {
    String modelName;
    String system;
    String prompt;
    Double temperature;
    Integer maxTokens;
    List<String> stop;
    /**
     * 非空时要求模型按该 JSON schema 输出。
     */
    Map<String, Object> responseSchema;
}
