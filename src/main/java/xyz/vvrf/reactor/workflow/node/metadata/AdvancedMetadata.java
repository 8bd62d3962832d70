package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;

@Getter
@Setter
public class AdvancedMetadata extends CommonMetadata {

    @NotBlank(message = "is required")
    private String expression;
}
