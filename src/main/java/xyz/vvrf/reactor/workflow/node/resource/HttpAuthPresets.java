package xyz.vvrf.reactor.workflow.node.resource;

import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 命名的认证请求头预设，get_api / post_api 通过 auth_preset 引用。
 * 预设中的请求头会被节点自己配置的同名请求头覆盖。
 */
public class HttpAuthPresets {

    private final Map<String, Map<String, String>> presets;

    public HttpAuthPresets(Map<String, Map<String, String>> presets) {
        this.presets = presets == null ? Collections.emptyMap() : new LinkedHashMap<>(presets);
    }

    public static HttpAuthPresets none() {
        return new HttpAuthPresets(null);
    }

    public Map<String, String> headersFor(String presetName, Map<String, String> nodeHeaders) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (presetName != null) {
            Map<String, String> preset = presets.get(presetName);
            if (preset == null) {
                throw new NodeExecutionException("unknown auth preset '" + presetName + "'");
            }
            headers.putAll(preset);
        }
        if (nodeHeaders != null) {
            headers.putAll(nodeHeaders);
        }
        return headers;
    }
}
