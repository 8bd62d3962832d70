package xyz.vvrf.reactor.workflow.exception;

/**
 * 节点配置不合法。fieldPath 是出错字段的点分路径（如 "body_map.user.id"），
 * 界面据此高亮具体字段；无法定位到字段时为 null。
 */
public class NodeValidationException extends WorkflowException {

    private final String fieldPath;

    public NodeValidationException(String fieldPath, String message) {
        super(format(fieldPath, message));
        this.fieldPath = fieldPath;
    }

    public NodeValidationException(String fieldPath, String message, Throwable cause) {
        super(format(fieldPath, message), cause);
        this.fieldPath = fieldPath;
    }

    private static String format(String fieldPath, String message) {
        return fieldPath == null ? message : fieldPath + ": " + message;
    }

    public String getFieldPath() {
        return fieldPath;
    }
}
