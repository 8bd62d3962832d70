package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;

@Getter
@Setter
public class ForEachMetadata extends CommonMetadata {

    @NotBlank(message = "is required")
    private String itemsSelector;

    /**
     * 并发提示，只保存不生效：迭代总是顺序执行。
     */
    @Positive(message = "must be greater than 0")
    private Integer concurrency;

    private Boolean flatten = Boolean.TRUE;
}
