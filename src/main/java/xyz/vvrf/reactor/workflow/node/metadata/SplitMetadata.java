package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.AssertTrue;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;

@Getter
@Setter
public class SplitMetadata extends CommonMetadata {

    /**
     * group_by 模式下对每个元素求值得到分组 key 的表达式（元素绑定为 #item）。
     */
    @NotBlank(message = "is required")
    private String by;

    private SplitMode mode = SplitMode.GROUP_BY;

    @Positive(message = "must be greater than 0")
    private Integer chunkSize;

    private String itemsSelector = "items";

    @AssertTrue(message = "is required when mode is 'chunk'")
    private boolean isChunkSize() {
        return mode != SplitMode.CHUNK || chunkSize != null;
    }
}
