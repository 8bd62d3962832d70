package xyz.vvrf.reactor.workflow.node;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.node.metadata.CommonMetadata;

import javax.validation.ConstraintViolation;
import javax.validation.Path;
import javax.validation.Validator;
import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 把节点 metadata（松散的 Map）绑定到对应类型的 metadata 类上。
 * <p>
 * 严格模式拒绝未知 key 并执行 Bean Validation；宽松模式用于规划和读取公共字段，
 * 忽略未知 key，绑定失败时返回默认实例。
 */
@Slf4j
public class MetadataBinder {

    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE = new PropertyNamingStrategies.SnakeCaseStrategy();

    private final ObjectMapper strictMapper;
    private final ObjectMapper lenientMapper;
    private final Validator validator;

    public MetadataBinder(ObjectMapper objectMapper, Validator validator) {
        Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
        this.strictMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
        this.lenientMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.validator = Objects.requireNonNull(validator, "Validator 不能为空");
    }

    /**
     * 严格绑定并校验。
     *
     * @throws NodeValidationException 未知 key、类型不匹配或约束不满足
     */
    public <M extends CommonMetadata> M bind(Map<String, Object> metadata, Class<M> metadataType) {
        M bound;
        try {
            bound = strictMapper.convertValue(metadata == null ? Collections.emptyMap() : metadata, metadataType);
        } catch (IllegalArgumentException e) {
            throw translate(e);
        }
        Set<ConstraintViolation<M>> violations = validator.validate(bound);
        if (!violations.isEmpty()) {
            ConstraintViolation<M> first = violations.stream()
                    .min(Comparator.comparing(v -> toSnakePath(v.getPropertyPath())))
                    .orElseThrow(IllegalStateException::new);
            throw new NodeValidationException(toSnakePath(first.getPropertyPath()), first.getMessage());
        }
        return bound;
    }

    /**
     * 宽松绑定，不抛异常。
     */
    public <M extends CommonMetadata> M bindLenient(Map<String, Object> metadata, Class<M> metadataType) {
        try {
            return lenientMapper.convertValue(metadata == null ? Collections.emptyMap() : metadata, metadataType);
        } catch (IllegalArgumentException e) {
            log.debug("宽松绑定 {} 失败，使用默认值: {}", metadataType.getSimpleName(), e.getMessage());
            return lenientMapper.convertValue(Collections.emptyMap(), metadataType);
        }
    }

    /**
     * 读取公共字段（超时、重试、on_error），供执行器使用。
     */
    public CommonMetadata bindCommon(Map<String, Object> metadata) {
        return bindLenient(metadata, CommonMetadata.class);
    }

    private NodeValidationException translate(IllegalArgumentException e) {
        Throwable cause = e.getCause();
        if (cause instanceof UnrecognizedPropertyException) {
            UnrecognizedPropertyException unknown = (UnrecognizedPropertyException) cause;
            String key = unknown.getPropertyName();
            return new NodeValidationException(jsonPath(unknown), "unknown key '" + key + "'", e);
        }
        if (cause instanceof JsonMappingException) {
            JsonMappingException mapping = (JsonMappingException) cause;
            String reason = mapping.getOriginalMessage();
            if (mapping.getCause() instanceof IllegalArgumentException) {
                reason = mapping.getCause().getMessage();
            }
            return new NodeValidationException(jsonPath(mapping), "invalid value: " + firstLine(reason), e);
        }
        return new NodeValidationException(null, "invalid metadata: " + firstLine(e.getMessage()), e);
    }

    private static String jsonPath(JsonMappingException e) {
        String path = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                .collect(Collectors.joining("."));
        return path.isEmpty() ? null : path;
    }

    private static String toSnakePath(Path path) {
        StringBuilder sb = new StringBuilder();
        for (Path.Node node : path) {
            if (node.getName() == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(SNAKE_CASE.translate(node.getName()));
        }
        return sb.toString();
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
