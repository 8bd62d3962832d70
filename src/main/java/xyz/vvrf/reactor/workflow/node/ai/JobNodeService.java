package xyz.vvrf.reactor.workflow.node.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.client.CompletionClient;
import xyz.vvrf.reactor.workflow.node.client.CompletionRequest;
import xyz.vvrf.reactor.workflow.node.metadata.JobMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.Map;

/**
 * job：把渲染后的提示词发送给模型。
 * 节点声明了 structured_output 时要求模型输出 JSON 并解析为对象，否则输出 {"text": ...}。
 */
@Slf4j
@NodeServiceType(NodeType.JOB)
public class JobNodeService extends AbstractNodeService<JobMetadata> {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;

    public JobNodeService(NodeServiceSupport support, CompletionClient completionClient, ObjectMapper objectMapper) {
        super(NodeType.JOB, JobMetadata.class, support);
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void validateMetadata(JobMetadata metadata) {
        checkTemplate(metadata.getPrompt(), "prompt");
        if (metadata.getSystem() != null) {
            checkTemplate(metadata.getSystem(), "system");
        }
    }

    @Override
    protected Map<String, Object> planShape(JobMetadata metadata, Map<String, Object> inputShape) {
        return shape("text", Shapes.STRING);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, JobMetadata metadata) {
        String prompt = render(metadata.getPrompt(), input, "prompt");
        String system = metadata.getSystem() == null ? null : render(metadata.getSystem(), input, "system");
        Map<String, Object> responseSchema = input.getStructuredOutput();

        String text = completionClient.complete(CompletionRequest.builder()
                .modelName(metadata.getModelName())
                .system(system)
                .prompt(prompt)
                .temperature(metadata.getTemperature())
                .maxTokens(metadata.getMaxTokens())
                .stop(metadata.getStop())
                .responseSchema(responseSchema.isEmpty() ? null : responseSchema)
                .build());

        if (responseSchema.isEmpty()) {
            return shape("text", text);
        }
        try {
            return objectMapper.readValue(text, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new NodeExecutionException("model output is not valid JSON for the declared structured_output", e);
        }
    }
}
