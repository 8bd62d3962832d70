package xyz.vvrf.reactor.workflow.node.resource;

import xyz.vvrf.reactor.workflow.exception.NodeValidationException;

import java.net.URI;
import java.net.URISyntaxException;

final class HttpUrls {

    private HttpUrls() {}

    /**
     * url 必须是带主机名的绝对 http/https 地址。
     */
    static void checkAbsoluteHttpUrl(String url, String fieldPath) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new NodeValidationException(fieldPath, "invalid URL: " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new NodeValidationException(fieldPath, "URL scheme must be http or https");
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new NodeValidationException(fieldPath, "URL must have a host");
        }
    }
}
