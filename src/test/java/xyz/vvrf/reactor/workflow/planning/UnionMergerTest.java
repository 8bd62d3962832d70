package xyz.vvrf.reactor.workflow.planning;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.reactor.workflow.test.util.TestWorkflows.map;

class UnionMergerTest {

    @Test
    void laterSourceWinsAndConflictIsNoted() {
        Map<Long, Map<String, Object>> sources = new LinkedHashMap<>();
        sources.put(2L, map("text", "from b", "score", 1));
        sources.put(3L, map("text", "from c", "label", "x"));

        UnionMerger.Result result = UnionMerger.merge(sources);

        assertThat(result.getMerged()).containsExactly(
                Map.entry("text", "from c"),
                Map.entry("score", 1),
                Map.entry("label", "x"));
        assertThat(result.getNotes())
                .containsExactly("key 'text' conflicts between parents [2, 3]; using value from 3");
    }

    @Test
    void equalValuesAreNotConflicts() {
        Map<Long, Map<String, Object>> sources = new LinkedHashMap<>();
        sources.put(1L, map("text", "same"));
        sources.put(2L, map("text", "same"));

        UnionMerger.Result result = UnionMerger.merge(sources);

        assertThat(result.getMerged()).containsEntry("text", "same");
        assertThat(result.getNotes()).isEmpty();
    }

    @Test
    void nullSourcesAreIgnored() {
        Map<Long, Map<String, Object>> sources = new LinkedHashMap<>();
        sources.put(1L, null);
        sources.put(2L, map("a", 1));

        assertThat(UnionMerger.merge(sources).getMerged()).containsExactly(Map.entry("a", 1));
    }

    @Test
    void inTopoOrderFollowsTopologicalIndexNotDeclarationOrder() {
        Map<Long, Map<String, Object>> values = new LinkedHashMap<>();
        values.put(9L, map("v", "nine"));
        values.put(4L, map("v", "four"));

        Map<Long, Map<String, Object>> ordered = UnionMerger.inTopoOrder(
                Arrays.asList(9L, 4L, 5L), Arrays.asList(4L, 5L, 9L), values);

        // 节点 5 没有值，被忽略
        assertThat(ordered.keySet()).containsExactly(4L, 9L);
        assertThat(UnionMerger.merge(ordered).getMerged()).containsEntry("v", "nine");
    }
}
