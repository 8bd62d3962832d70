package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.Positive;

@Getter
@Setter
public class MergeMetadata extends CommonMetadata {

    private MergeStrategy strategy = MergeStrategy.UNION;

    @Positive(message = "must be greater than 0")
    private Integer expectedParents;
}
