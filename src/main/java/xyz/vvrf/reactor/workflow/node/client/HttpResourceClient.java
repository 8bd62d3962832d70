package xyz.vvrf.reactor.workflow.node.client;

import xyz.vvrf.reactor.workflow.node.metadata.ContentType;

import java.util.Map;

/**
 * get_api / post_api 节点使用的 HTTP 调用接口。调用方负责超时控制，实现可以阻塞。
 */
public interface HttpResourceClient {

    HttpResponse get(String url, Map<String, String> headers, Map<String, Object> queryParams);

    HttpResponse post(String url, Map<String, String> headers, ContentType contentType, Object body);
}
