package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;
import java.util.List;

@Getter
@Setter
public class JobMetadata extends CommonMetadata {

    @NotBlank(message = "is required")
    private String prompt;

    @NotBlank(message = "is required")
    private String modelName;

    @DecimalMin(value = "0.0", message = "must be between 0 and 2")
    @DecimalMax(value = "2.0", message = "must be between 0 and 2")
    private Double temperature;

    @Positive(message = "must be greater than 0")
    private Integer maxTokens;

    private List<String> stop;

    private String system;
}
