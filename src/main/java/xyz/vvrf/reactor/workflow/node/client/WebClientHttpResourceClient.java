package xyz.vvrf.reactor.workflow.node.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.node.metadata.ContentType;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 Spring {@link WebClient} 的 {@link HttpResourceClient}。
 * 非 2xx 响应不视为异常，状态码和响应体原样返回给节点输出。
 */
@Slf4j
public class WebClientHttpResourceClient implements HttpResourceClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientHttpResourceClient(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = Objects.requireNonNull(webClient, "WebClient 不能为空");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    @Override
    public HttpResponse get(String url, Map<String, String> headers, Map<String, Object> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        if (queryParams != null) {
            queryParams.forEach((name, value) -> builder.queryParam(name, value == null ? "" : String.valueOf(value)));
        }
        URI uri = builder.build().encode().toUri();
        log.debug("GET {}", uri);
        return webClient.get()
                .uri(uri)
                .headers(h -> applyHeaders(h, headers))
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new HttpResponse(response.rawStatusCode(), parseBody(body))))
                .blockOptional()
                .orElseThrow(() -> new NodeExecutionException("GET " + url + " returned no response"));
    }

    @Override
    public HttpResponse post(String url, Map<String, String> headers, ContentType contentType, Object body) {
        ContentType effective = contentType == null ? ContentType.JSON : contentType;
        log.debug("POST {} ({})", url, effective.getMediaType());
        WebClient.RequestBodySpec request = webClient.post()
                .uri(URI.create(url))
                .headers(h -> applyHeaders(h, headers))
                .contentType(MediaType.parseMediaType(effective.getMediaType()));
        WebClient.RequestHeadersSpec<?> withBody;
        switch (effective) {
            case FORM:
                withBody = request.body(BodyInserters.fromFormData(toForm(body)));
                break;
            case TEXT:
                withBody = request.bodyValue(body instanceof String ? body : writeJson(body));
                break;
            case JSON:
            default:
                withBody = request.bodyValue(writeJson(body));
                break;
        }
        return withBody
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(responseBody -> new HttpResponse(response.rawStatusCode(), parseBody(responseBody))))
                .blockOptional()
                .orElseThrow(() -> new NodeExecutionException("POST " + url + " returned no response"));
    }

    private void applyHeaders(org.springframework.http.HttpHeaders target, Map<String, String> headers) {
        if (headers != null) {
            headers.forEach(target::set);
        }
    }

    private MultiValueMap<String, String> toForm(Object body) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        if (body instanceof Map) {
            ((Map<?, ?>) body).forEach((k, v) -> form.add(String.valueOf(k), v == null ? "" : String.valueOf(v)));
        }
        return form;
    }

    private String writeJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new NodeExecutionException("request body is not serializable to JSON", e);
        }
    }

    private Object parseBody(String body) {
        if (body.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            log.trace("响应体不是 JSON，按文本返回: {}", e.getOriginalMessage());
            return body;
        }
    }
}
