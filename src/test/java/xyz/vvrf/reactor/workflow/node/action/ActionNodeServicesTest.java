package xyz.vvrf.reactor.workflow.node.action;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.RunScope;
import xyz.vvrf.reactor.workflow.exception.ExpressionEvaluationException;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.test.util.TestWorkflows;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.vvrf.reactor.workflow.test.util.TestWorkflows.map;

class ActionNodeServicesTest {

    private final NodeServiceSupport support = TestWorkflows.nodeServiceSupport();
    private final RunScope scope = RunScope.detached(map("run_id", "run-1"));

    private NodeInput input(Object... keyValues) {
        return NodeInput.of(map(keyValues), scope);
    }

    @Nested
    class Filter {

        private final FilterNodeService service = new FilterNodeService(support);

        @Test
        void passesInputThroughWhenPredicateHolds() {
            assertThat(service.execute(input("score", 7, "name", "a"), map("where", "score > 5")))
                    .isEqualTo(map("score", 7, "name", "a"));
        }

        @Test
        void outputsEmptyObjectWhenPredicateFails() {
            assertThat(service.execute(input("score", 3), map("where", "score > 5"))).isEmpty();
        }

        @Test
        void filtersSelectedItems() {
            Map<String, Object> output = service.execute(input("items", Arrays.asList(1, 2, 3)),
                    map("items_selector", "items", "where", "#item > 1"));

            assertThat(output).isEqualTo(map("items", Arrays.asList(2, 3)));
        }

        @Test
        void itemsSelectorMustSelectAnArray() {
            assertThatThrownBy(() -> service.execute(input("items", "nope"), map("items_selector", "items", "where", "true")))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessage("items_selector must select an array but got string");
        }

        @Test
        void validationReportsMissingAndMalformedPredicate() {
            assertThatThrownBy(() -> service.validate(map(), null))
                    .isInstanceOf(NodeValidationException.class)
                    .hasMessage("where: is required");
            assertThatThrownBy(() -> service.validate(map("where", "score >"), null))
                    .isInstanceOf(NodeValidationException.class)
                    .extracting(e -> ((NodeValidationException) e).getFieldPath())
                    .isEqualTo("where");
        }

        @Test
        void planPassesInputShapeThrough() {
            assertThat(service.plan(map("where", "true"), map("text", "string"), null))
                    .isEqualTo(map("text", "string"));
            assertThat(service.plan(map("where", "true", "items_selector", "items"), map("text", "string"), null))
                    .isEqualTo(map("items", "array"));
        }
    }

    @Nested
    class MapNode {

        private final MapNodeService service = new MapNodeService(support);

        @Test
        void stringValuesAreExpressionsOtherValuesAreLiterals() {
            Map<String, Object> output = service.execute(input("name", "Ada"),
                    map("mapping", map("greeting", "'hi ' + name", "n", 3, "ok", true)));

            assertThat(output).isEqualTo(map("greeting", "hi Ada", "n", 3, "ok", true));
        }

        @Test
        void mappingValuesMustBeExpressionsOrLiterals() {
            assertThatThrownBy(() -> service.validate(map("mapping", map("bad", Arrays.asList(1, 2))), null))
                    .isInstanceOf(NodeValidationException.class)
                    .extracting(e -> ((NodeValidationException) e).getFieldPath())
                    .isEqualTo("mapping.bad");
            assertThatThrownBy(() -> service.validate(map("mapping", map()), null))
                    .isInstanceOf(NodeValidationException.class)
                    .hasMessage("mapping: cannot be empty");
        }

        @Test
        void planMarksExpressionsAsUnknown() {
            assertThat(service.plan(map("mapping", map("a", "x", "b", 1.5)), map(), null))
                    .isEqualTo(map("a", "unknown", "b", "number"));
        }
    }

    @Nested
    class IfElse {

        private final IfElseNodeService service = new IfElseNodeService(support);

        @Test
        void addsConditionResultToInput() {
            assertThat(service.execute(input("score", 7), map("predicate", "score > 5")))
                    .isEqualTo(map("score", 7, "condition_result", true));
            assertThat(service.execute(input("score", 1), map("predicate", "score > 5")))
                    .containsEntry("condition_result", false);
        }

        @Test
        void nonBooleanPredicateFails() {
            assertThatThrownBy(() -> service.execute(input("score", 7), map("predicate", "score")))
                    .isInstanceOf(ExpressionEvaluationException.class);
        }
    }

    @Nested
    class ForEach {

        private final ForEachNodeService service = new ForEachNodeService(support);

        @Test
        void selectsItemsToIterate() {
            assertThat(service.execute(input("rows", Arrays.asList("a", "b")), map("items_selector", "rows")))
                    .isEqualTo(map("items", Arrays.asList("a", "b")));
        }

        @Test
        void nullSelectionIteratesNothing() {
            assertThat(service.execute(input(), map("items_selector", "#input['rows']")))
                    .isEqualTo(map("items", Collections.emptyList()));
        }

        @Test
        void nonArraySelectionFails() {
            assertThatThrownBy(() -> service.execute(input("rows", 5), map("items_selector", "rows")))
                    .isInstanceOf(NodeExecutionException.class);
        }

        @Test
        void planDescribesLoopOutput() {
            assertThat(service.plan(map("items_selector", "rows"), map(), null))
                    .isEqualTo(map("items_processed", "number", "results", "array"));
        }
    }

    @Nested
    class Merge {

        private final MergeNodeService service = new MergeNodeService(support);

        private NodeInput parents() {
            Map<Long, Map<String, Object>> declared = new LinkedHashMap<>();
            declared.put(2L, map("k", "two", "n", null, "list", Arrays.asList(2)));
            declared.put(3L, map("k", "three", "n", 3, "list", Arrays.asList(3)));
            return NodeInput.of(map(), declared, declared, scope);
        }

        @Test
        void unionLetsLaterParentWin() {
            assertThat(service.execute(parents(), map("strategy", "union")))
                    .isEqualTo(map("k", "three", "n", 3, "list", Arrays.asList(3)));
        }

        @Test
        void concatAppendsArrays() {
            assertThat(service.execute(parents(), map("strategy", "concat")))
                    .isEqualTo(map("k", "three", "n", 3, "list", Arrays.asList(2, 3)));
        }

        @Test
        void preferLeftKeepsFirstNonNullValue() {
            assertThat(service.execute(parents(), map("strategy", "prefer_left")))
                    .isEqualTo(map("k", "two", "n", 3, "list", Arrays.asList(2)));
        }

        @Test
        void entryMergePassesInputThrough() {
            assertThat(service.execute(input("a", 1), map())).isEqualTo(map("a", 1));
        }

        @Test
        void unknownStrategyIsRejected() {
            assertThatThrownBy(() -> service.validate(map("strategy", "zip"), null))
                    .isInstanceOf(NodeValidationException.class)
                    .hasMessageContaining("strategy must be one of union, concat, prefer_left")
                    .extracting(e -> ((NodeValidationException) e).getFieldPath())
                    .isEqualTo("strategy");
        }
    }

    @Nested
    class Split {

        private final SplitNodeService service = new SplitNodeService(support);

        @Test
        void groupsItemsByKey() {
            List<Object> rows = Arrays.asList(map("kind", "a", "v", 1), map("kind", "b", "v", 2), map("kind", "a", "v", 3));

            Map<String, Object> output = service.execute(input("rows", rows),
                    map("items_selector", "rows", "by", "#item['kind']"));

            assertThat(output).isEqualTo(map("groups", map(
                    "a", Arrays.asList(rows.get(0), rows.get(2)),
                    "b", Collections.singletonList(rows.get(1)))));
        }

        @Test
        void chunksItemsBySize() {
            Map<String, Object> output = service.execute(input("items", Arrays.asList(1, 2, 3)),
                    map("mode", "chunk", "chunk_size", 2, "by", "#item"));

            assertThat(output).isEqualTo(map("chunks", Arrays.asList(Arrays.asList(1, 2), Collections.singletonList(3))));
        }

        @Test
        void chunkModeRequiresChunkSize() {
            assertThatThrownBy(() -> service.validate(map("mode", "chunk", "by", "#item"), null))
                    .isInstanceOf(NodeValidationException.class)
                    .hasMessageContaining("is required when mode is 'chunk'");
        }
    }

    @Nested
    class Advanced {

        private final AdvancedNodeService service = new AdvancedNodeService(support);

        @Test
        void objectResultBecomesOutput() {
            assertThat(service.execute(input("count", 2), map("expression", "{sum: count + 1}")))
                    .isEqualTo(map("sum", 3));
        }

        @Test
        void scalarResultIsWrapped() {
            assertThat(service.execute(input("count", 2), map("expression", "count * 2")))
                    .isEqualTo(map("result", 4));
        }
    }

    @Nested
    class Return {

        private final ReturnNodeService service = new ReturnNodeService(support);

        @Test
        void selectsPayloadWithDefaults() {
            assertThat(service.execute(input("answer", "42"), map("payload_selector", "answer")))
                    .isEqualTo(map("payload", "42", "status_code", 200, "content_type", "application/json"));
        }

        @Test
        void statusCodeMustBeInHttpRange() {
            assertThatThrownBy(() -> service.validate(map("payload_selector", "answer", "status_code", 700), null))
                    .isInstanceOf(NodeValidationException.class)
                    .hasMessage("status_code: must be between 100 and 599");
        }
    }

    @Nested
    class WorkflowCall {

        private final WorkflowCallNodeService service = new WorkflowCallNodeService(support);

        @Test
        void runsChildWorkflowWithMappedInputs() {
            AtomicReference<Map<String, Object>> receivedInputs = new AtomicReference<>();
            AtomicReference<RunScope> receivedScope = new AtomicReference<>();
            RunScope parentScope = new RunScope("run-1", 1L, 0, map("identity", "user-1"), (workflowId, inputs, s) -> {
                receivedInputs.set(inputs);
                receivedScope.set(s);
                return map("answer", workflowId);
            });

            Map<String, Object> output = service.execute(NodeInput.of(map("value", 1), parentScope),
                    map("workflow_id", 7, "input_mapping", map("x", "value + 1")));

            assertThat(output).isEqualTo(map("answer", 7L));
            assertThat(receivedInputs.get()).isEqualTo(map("x", 2));
            assertThat(receivedScope.get().getBase()).containsEntry("identity", "user-1");
        }

        @Test
        void identityIsDroppedWhenNotPropagated() {
            AtomicReference<RunScope> receivedScope = new AtomicReference<>();
            RunScope parentScope = new RunScope("run-1", 1L, 0, map("identity", "user-1", "run_id", "run-1"), (workflowId, inputs, s) -> {
                receivedScope.set(s);
                return null;
            });

            Map<String, Object> output = service.execute(NodeInput.of(map("value", 1), parentScope),
                    map("workflow_id", 7, "propagate_identity", false));

            assertThat(output).isEmpty();
            assertThat(receivedScope.get().getBase()).doesNotContainKey("identity").containsEntry("run_id", "run-1");
        }

        @Test
        void workflowIdIsRequired() {
            assertThatThrownBy(() -> service.validate(map(), null))
                    .isInstanceOf(NodeValidationException.class)
                    .hasMessage("workflow_id: is required");
        }
    }
}
