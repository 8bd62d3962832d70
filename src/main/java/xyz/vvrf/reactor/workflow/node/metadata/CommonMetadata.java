package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;
import xyz.vvrf.reactor.workflow.core.OnErrorPolicy;

import javax.validation.constraints.Min;
import javax.validation.constraints.Positive;
import java.util.List;

/**
 * 所有节点类型共有的 metadata 字段。
 */
@Getter
@Setter
public class CommonMetadata {

    private String name;

    private String description;

    /**
     * execute() 的超时，未设置时使用全局默认值。
     */
    @Positive(message = "must be greater than 0")
    private Long timeoutMs;

    /**
     * 失败后的重试次数。
     */
    @Min(value = 0, message = "must be greater than or equal to 0")
    private Integer retry;

    private OnErrorPolicy onError;

    private List<String> tags;

    public OnErrorPolicy effectiveOnError() {
        return onError != null ? onError : OnErrorPolicy.FAIL;
    }
}
