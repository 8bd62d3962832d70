package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Positive;
import java.util.Map;

@Getter
@Setter
public class WorkflowCallMetadata extends CommonMetadata {

    @NotNull(message = "is required")
    @Positive(message = "must be greater than 0")
    private Long workflowId;

    /**
     * 子工作流起始输入 key 到表达式的映射；未设置时把当前输入整体传入。
     */
    private Map<String, String> inputMapping;

    private Boolean propagateIdentity = Boolean.TRUE;

    @Pattern(regexp = "^sync$", message = "only 'sync' is supported")
    private String wait = "sync";
}
