package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;

@Getter
@Setter
public class ReturnMetadata extends CommonMetadata {

    @NotBlank(message = "is required")
    private String payloadSelector;

    private ContentType contentType = ContentType.JSON;

    @Min(value = 100, message = "must be between 100 and 599")
    @Max(value = 599, message = "must be between 100 and 599")
    private Integer statusCode = 200;
}
