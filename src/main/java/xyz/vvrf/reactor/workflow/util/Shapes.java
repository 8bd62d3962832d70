package xyz.vvrf.reactor.workflow.util;

import xyz.vvrf.reactor.workflow.exception.NodeValidationException;

import java.util.*;

/**
 * 数据形状（只描述 key 和值类型，不含具体值）相关的工具方法。
 */
public final class Shapes {

    public static final String STRING = "string";
    public static final String NUMBER = "number";
    public static final String BOOLEAN = "boolean";
    public static final String ARRAY = "array";
    public static final String OBJECT = "object";
    public static final String NULL = "null";
    public static final String UNKNOWN = "unknown";

    private static final Set<String> SCHEMA_TYPES = new HashSet<>(Arrays.asList(
            STRING, NUMBER, "integer", BOOLEAN, ARRAY, OBJECT, NULL));

    private Shapes() {}

    /**
     * 从声明的 structured_output 提取形状。
     * JSON-schema 风格（type=object + properties）展开为 {key: type}，数组为 {"type":"array"}，
     * 没有 type 字段的普通形状原样返回。
     */
    public static Map<String, Object> fromStructuredOutput(Map<String, Object> structuredOutput) {
        if (structuredOutput == null || structuredOutput.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Object type = structuredOutput.get("type");
        if (type == null) {
            return new LinkedHashMap<>(structuredOutput);
        }
        Map<String, Object> shape = new LinkedHashMap<>();
        if (OBJECT.equals(type) && structuredOutput.get("properties") instanceof Map) {
            Map<?, ?> properties = (Map<?, ?>) structuredOutput.get("properties");
            properties.forEach((key, schema) -> shape.put(String.valueOf(key), typeOfSchema(schema)));
            return shape;
        }
        shape.put("type", ARRAY.equals(type) ? ARRAY : type);
        return shape;
    }

    private static Object typeOfSchema(Object schema) {
        if (!(schema instanceof Map)) {
            return UNKNOWN;
        }
        Map<?, ?> map = (Map<?, ?>) schema;
        Object type = map.get("type");
        if (type == null) {
            return UNKNOWN;
        }
        if (OBJECT.equals(type) && map.get("properties") instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            ((Map<?, ?>) map.get("properties")).forEach((key, value) -> nested.put(String.valueOf(key), typeOfSchema(value)));
            return nested;
        }
        if (ARRAY.equals(type)) {
            Map<String, Object> array = new LinkedHashMap<>();
            array.put("type", ARRAY);
            if (map.containsKey("items")) {
                array.put("items", typeOfSchema(map.get("items")));
            }
            return array;
        }
        return type;
    }

    /**
     * 描述一个真实值的形状：对象描述每个 key 的类型名，其它值描述为 {"type": 类型名}。
     */
    public static Map<String, Object> describe(Object data) {
        Map<String, Object> shape = new LinkedHashMap<>();
        if (data instanceof Map) {
            ((Map<?, ?>) data).forEach((key, value) -> shape.put(String.valueOf(key), typeName(value)));
        } else {
            shape.put("type", typeName(data));
        }
        return shape;
    }

    public static String typeName(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof CharSequence) {
            return STRING;
        }
        if (value instanceof Collection || value.getClass().isArray()) {
            return ARRAY;
        }
        if (value instanceof Map) {
            return OBJECT;
        }
        return UNKNOWN;
    }

    /**
     * 校验 structured_output：若声明了 type，必须是 JSON-schema 的基本类型名，properties 必须是对象。
     *
     * @throws NodeValidationException 不合法时，fieldPath 以 "structured_output" 开头
     */
    public static void validateStructuredOutput(Map<String, Object> structuredOutput) {
        if (structuredOutput == null || structuredOutput.isEmpty() || !structuredOutput.containsKey("type")) {
            return;
        }
        validateSchema(structuredOutput, "structured_output");
    }

    private static void validateSchema(Map<?, ?> schema, String path) {
        Object type = schema.get("type");
        if (type != null && !SCHEMA_TYPES.contains(String.valueOf(type))) {
            throw new NodeValidationException(path + ".type", "invalid JSON schema type '" + type + "'");
        }
        Object properties = schema.get("properties");
        if (properties != null) {
            if (!(properties instanceof Map)) {
                throw new NodeValidationException(path + ".properties", "must be an object");
            }
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) properties).entrySet()) {
                if (entry.getValue() instanceof Map) {
                    validateSchema((Map<?, ?>) entry.getValue(), path + ".properties." + entry.getKey());
                } else {
                    throw new NodeValidationException(path + ".properties." + entry.getKey(), "must be an object");
                }
            }
        }
        Object items = schema.get("items");
        if (items instanceof Map) {
            validateSchema((Map<?, ?>) items, path + ".items");
        }
    }
}
