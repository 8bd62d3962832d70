package xyz.vvrf.reactor.workflow.node.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * post_api 请求体和 return 输出支持的内容类型。
 */
public enum ContentType {
    JSON("application/json"),
    FORM("application/x-www-form-urlencoded"),
    TEXT("text/plain");

    private final String mediaType;

    ContentType(String mediaType) {
        this.mediaType = mediaType;
    }

    @JsonValue
    public String getMediaType() {
        return mediaType;
    }

    @JsonCreator
    public static ContentType of(String mediaType) {
        for (ContentType type : values()) {
            if (type.mediaType.equals(mediaType)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unsupported content type '" + mediaType + "'");
    }
}
