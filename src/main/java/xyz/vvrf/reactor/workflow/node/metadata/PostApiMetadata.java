package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import java.util.Map;

@Getter
@Setter
public class PostApiMetadata extends CommonMetadata {

    @NotBlank(message = "is required")
    private String url;

    private Map<String, String> headers;

    /**
     * 请求体模板：字符串值是表达式，数字/布尔/null 是字面量，对象可以嵌套。
     */
    private Map<String, Object> bodyMap;

    private ContentType contentType = ContentType.JSON;

    private String authPreset;
}
