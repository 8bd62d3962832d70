package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;
import java.util.Map;

@Getter
@Setter
public class VectorQueryMetadata extends CommonMetadata {

    @NotBlank(message = "is required")
    private String vectorStoreId;

    private String namespace;

    @NotBlank(message = "is required")
    private String queryTemplate;

    @Positive(message = "must be greater than 0")
    private Integer topK = 5;

    private Map<String, Object> filters;
}
