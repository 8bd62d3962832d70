package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import java.util.Map;

@Getter
@Setter
public class GetApiMetadata extends CommonMetadata {

    @NotBlank(message = "is required")
    private String url;

    private Map<String, String> headers;

    /**
     * 查询参数名到表达式的映射。
     */
    private Map<String, String> queryMap;

    private String authPreset;
}
