package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;

@Getter
@Setter
public class FilterMetadata extends CommonMetadata {

    private String itemsSelector;

    @NotBlank(message = "is required")
    private String where;
}
