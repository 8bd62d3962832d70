package xyz.vvrf.reactor.workflow.node.resource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.RunScope;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.client.HttpResourceClient;
import xyz.vvrf.reactor.workflow.node.client.HttpResponse;
import xyz.vvrf.reactor.workflow.node.metadata.ContentType;
import xyz.vvrf.reactor.workflow.test.util.TestWorkflows;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static xyz.vvrf.reactor.workflow.test.util.TestWorkflows.map;

@ExtendWith(MockitoExtension.class)
class HttpNodeServicesTest {

    @Mock
    private HttpResourceClient httpClient;

    private final NodeServiceSupport support = TestWorkflows.nodeServiceSupport();
    private final HttpAuthPresets presets = new HttpAuthPresets(
            Collections.singletonMap("internal", Map.of("Authorization", "Bearer secret", "X-Team", "core")));
    private final RunScope scope = RunScope.detached(map());

    @Nested
    class GetApi {

        private GetApiNodeService service;

        @BeforeEach
        void setUp() {
            service = new GetApiNodeService(support, httpClient, presets);
        }

        @Test
        void evaluatesQueryAndMergesPresetHeaders() {
            when(httpClient.get("https://api.example.com/items",
                    Map.of("Authorization", "Bearer secret", "X-Team", "node"),
                    map("q", "rivers")))
                    .thenReturn(new HttpResponse(200, map("count", 3)));

            assertThat(service.execute(NodeInput.of(map("topic", "rivers"), scope), map(
                    "url", "https://api.example.com/items",
                    "query_map", map("q", "topic"),
                    "headers", map("X-Team", "node"),
                    "auth_preset", "internal")))
                    .isEqualTo(map("status", 200, "body", map("count", 3)));
        }

        @Test
        void unknownPresetFails() {
            assertThatThrownBy(() -> service.execute(NodeInput.of(map(), scope),
                    map("url", "https://api.example.com/items", "auth_preset", "missing")))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessage("unknown auth preset 'missing'");
            verifyNoInteractions(httpClient);
        }

        @Test
        void urlMustBeAbsoluteHttp() {
            assertThatThrownBy(() -> service.validate(map("url", "ftp://files.example.com"), null))
                    .isInstanceOf(NodeValidationException.class)
                    .hasMessage("url: URL scheme must be http or https");
            assertThatThrownBy(() -> service.validate(map("url", "/relative/path"), null))
                    .isInstanceOf(NodeValidationException.class)
                    .hasMessage("url: URL scheme must be http or https");
        }
    }

    @Nested
    class PostApi {

        @Test
        void buildsNestedBodyFromExpressions() {
            PostApiNodeService service = new PostApiNodeService(support, httpClient, HttpAuthPresets.none());
            when(httpClient.post("https://api.example.com/notes",
                    Collections.emptyMap(),
                    ContentType.JSON,
                    map("title", "rivers", "meta", map("length", 6, "draft", true))))
                    .thenReturn(new HttpResponse(201, map("id", "n-1")));

            assertThat(service.execute(NodeInput.of(map("topic", "rivers"), scope), map(
                    "url", "https://api.example.com/notes",
                    "body_map", map("title", "topic", "meta", map("length", "topic.length()", "draft", true)))))
                    .isEqualTo(map("status", 201, "body", map("id", "n-1")));
        }
    }
}
