package xyz.vvrf.reactor.workflow.node.client;

import lombok.Value;

/**
 * get_api / post_api 的响应：状态码和解析后的响应体（JSON 解析失败时为原始文本）。
 */
@Value
public class HttpResponse {
    int status;
    Object body;
}
