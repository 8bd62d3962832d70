package xyz.vvrf.reactor.workflow.node.metadata;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import java.util.Map;

@Getter
@Setter
public class EmbedMetadata extends CommonMetadata {

    @NotBlank(message = "is required")
    private String vectorStoreId;

    private String namespace;

    private String modelName;

    /**
     * 选出待向量化文本的表达式，结果可以是字符串或字符串数组。
     */
    @NotBlank(message = "is required")
    private String inputSelector;

    private String idSelector;

    /**
     * 向量元数据字段名到表达式的映射。
     */
    private Map<String, String> metadataMap;

    private Boolean upsert = Boolean.TRUE;
}
