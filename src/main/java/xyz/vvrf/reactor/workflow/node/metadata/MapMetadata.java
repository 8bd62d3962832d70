package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotEmpty;
import java.util.Map;

@Getter
@Setter
public class MapMetadata extends CommonMetadata {

    /**
     * 输出 key 到表达式（字符串）或字面量（数字/布尔）的映射。
     */
    @NotEmpty(message = "cannot be empty")
    private Map<String, Object> mapping;
}
