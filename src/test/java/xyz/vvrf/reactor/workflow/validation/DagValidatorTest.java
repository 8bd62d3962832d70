package xyz.vvrf.reactor.workflow.validation;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.core.DagValidationResult;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.test.util.TestWorkflows;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DagValidatorTest {

    private final DagValidator validator = new DagValidator();

    private DagValidationResult validate(TestWorkflows.Builder builder) {
        return validator.validate(builder.nodes(), builder.edges());
    }

    @Test
    void fourNodeDiamondWithMergeIsValidAndWarnsAboutMissingTrigger() {
        TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                .node(1, NodeType.JOB, "prompt", "Summarize {{ input.topic }}", "model_name", "gpt-test")
                .node(2, NodeType.FILTER, "where", "text != null")
                .node(3, NodeType.MAP, "mapping", TestWorkflows.map("copy", "text"))
                .node(4, NodeType.MERGE)
                .edge(1, 2)
                .edge(1, 3)
                .edge(2, 4)
                .edge(3, 4);

        DagValidationResult result = validator.validate(new Workflow(1, "wf", null, false), builder.nodes(), builder.edges());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).containsExactly(DagValidator.NO_TRIGGER_WARNING);
        assertThat(result.getTopoOrder()).containsExactly(1L, 2L, 3L, 4L);
    }

    @Test
    void emptyGraphIsValid() {
        DagValidationResult result = validator.validate(Collections.emptyList(), Collections.emptyList());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getTopoOrder()).isEmpty();
    }

    @Test
    void isolatedNodesAreExtraEntriesOrderedById() {
        TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                .node(3, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                .node(1, NodeType.MAP, "mapping", TestWorkflows.map("b", 2))
                .node(2, NodeType.MAP, "mapping", TestWorkflows.map("c", 3));

        assertThat(validate(builder).getTopoOrder()).containsExactly(1L, 2L, 3L);
    }

    @Test
    void sameGraphInAnyDeclarationOrderGivesSameResult() {
        TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                .node(5, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                .node(2, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                .node(7, NodeType.MERGE)
                .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                .edge(1, 5)
                .edge(2, 7)
                .edge(5, 7);

        DagValidationResult first = validate(builder);
        List<WorkflowNode> reversed = new ArrayList<>(builder.nodes());
        Collections.reverse(reversed);
        DagValidationResult second = validator.validate(reversed, builder.edges());

        assertThat(first).isEqualTo(second);
        assertThat(first.getTopoOrder()).containsExactly(1L, 2L, 5L, 7L);
    }

    @Nested
    class Cycles {

        @Test
        void twoNodeCycleIsReportedWithPathAndEmptyOrder() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .node(2, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .edge(1, 2)
                    .edge(2, 1);

            DagValidationResult result = validate(builder);

            assertThat(result.isValid()).isFalse();
            assertThat(result.getErrors()).containsExactly("cycle detected: 1 -> 2 -> 1");
            assertThat(result.getTopoOrder()).isEmpty();
        }

        @Test
        void cycleBehindValidPrefixStillClearsOrder() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .node(2, NodeType.MERGE)
                    .node(3, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .edge(1, 2)
                    .edge(2, 3)
                    .edge(3, 2);

            DagValidationResult result = validate(builder);

            assertThat(result.getErrors()).containsExactly("cycle detected: 2 -> 3 -> 2");
            assertThat(result.getTopoOrder()).isEmpty();
        }

        @Test
        void selfLoopIsBothAnEdgeErrorAndACycle() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .edge(1, 1);

            DagValidationResult result = validate(builder);

            assertThat(result.getErrors()).containsExactly(
                    "edge 100 is a self loop on node 1",
                    "cycle detected: 1 -> 1");
        }
    }

    @Nested
    class EdgeReferences {

        @Test
        void edgeToUnknownNodeIsAnError() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .edge(1, 9);

            DagValidationResult result = validate(builder);

            assertThat(result.getErrors()).containsExactly("edge 100 references unknown node 9");
            assertThat(result.getTopoOrder()).isEmpty();
        }

        @Test
        void duplicateEdgeIsAnError() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .node(2, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .edge(1, 2)
                    .edge(1, 2);

            assertThat(validate(builder).getErrors()).containsExactly("edge 101 duplicates 1 -> 2");
        }
    }

    @Nested
    class FanIn {

        @Test
        void nonMergeNodeWithTwoParentsIsAnError() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .node(2, NodeType.MAP, "mapping", TestWorkflows.map("b", 1))
                    .node(4, NodeType.FILTER, "where", "true")
                    .edge(1, 4)
                    .edge(2, 4);

            DagValidationResult result = validate(builder);

            assertThat(result.getErrors()).containsExactly("node 4 (filter) has 2 parents but is not a merge node");
            assertThat(result.getTopoOrder()).isEmpty();
        }

        @Test
        void mergeNodeMayHaveManyParents() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .node(2, NodeType.MAP, "mapping", TestWorkflows.map("b", 1))
                    .node(3, NodeType.MAP, "mapping", TestWorkflows.map("c", 1))
                    .node(4, NodeType.MERGE)
                    .edge(1, 4)
                    .edge(2, 4)
                    .edge(3, 4);

            assertThat(validate(builder).isValid()).isTrue();
        }
    }

    @Nested
    class ReturnPlacement {

        @Test
        void returnWithOutgoingEdgeIsAnError() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .node(2, NodeType.RETURN, "payload_selector", "a")
                    .node(3, NodeType.MAP, "mapping", TestWorkflows.map("b", 1))
                    .edge(1, 2)
                    .edge(2, 3);

            assertThat(validate(builder).getErrors()).containsExactly("return node 2 has outgoing edges");
        }

        @Test
        void isolatedReturnIsAnError() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.RETURN, "payload_selector", "a");

            assertThat(validate(builder).getErrors()).containsExactly("return node 1 has no incoming edges");
        }

        @Test
        void returnUnderForEachIsAnError() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.FOR_EACH, "items_selector", "items")
                    .node(2, NodeType.MAP, "mapping", TestWorkflows.map("a", "#item"))
                    .node(3, NodeType.RETURN, "payload_selector", "a")
                    .edge(1, 2)
                    .edge(2, 3);

            assertThat(validate(builder).getErrors())
                    .containsExactly("return nested under for_each: return node 3 has for_each ancestor 1");
        }

        @Test
        void returnAtTheEndOfAChainIsValid() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .node(2, NodeType.RETURN, "payload_selector", "a")
                    .edge(1, 2);

            assertThat(validate(builder).isValid()).isTrue();
        }
    }

    @Nested
    class BranchLabels {

        @Test
        void ifElseWithTrueAndFalseEdgesIsValidWithoutWarnings() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.IF_ELSE, "predicate", "score > 5")
                    .node(2, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .node(3, NodeType.MAP, "mapping", TestWorkflows.map("b", 1))
                    .labeled(1, 2, "true")
                    .labeled(1, 3, "false");

            DagValidationResult result = validate(builder);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        void ifElseEdgeWithoutLabelIsAnError() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.IF_ELSE, "predicate", "score > 5")
                    .node(2, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .edge(1, 2);

            DagValidationResult result = validate(builder);

            assertThat(result.getErrors())
                    .containsExactly("if_else node 1 has edge to 2 with branch_label none; expected 'true' or 'false'");
            assertThat(result.getWarnings())
                    .containsExactly("if_else node 1 should have exactly one 'true' and one 'false' edge (true: 0, false: 0)");
        }

        @Test
        void ifElseWithOnlyTrueBranchIsAWarning() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.IF_ELSE, "predicate", "score > 5")
                    .node(2, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .labeled(1, 2, "true");

            DagValidationResult result = validate(builder);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings())
                    .containsExactly("if_else node 1 should have exactly one 'true' and one 'false' edge (true: 1, false: 0)");
        }

        @Test
        void ifElseWithoutOutgoingEdgesIsAWarning() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.IF_ELSE, "predicate", "score > 5");

            assertThat(validate(builder).getWarnings()).containsExactly("if_else node 1 has no outgoing edges");
        }

        @Test
        void labelOnNonIfElseEdgeIsAnError() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.FILTER, "where", "true")
                    .node(2, NodeType.MAP, "mapping", TestWorkflows.map("a", 1))
                    .labeled(1, 2, "true");

            assertThat(validate(builder).getErrors()).containsExactly(
                    "node 1 (filter) has edge to 2 with branch_label 'true' but only if_else nodes can have branch labels");
        }
    }

    @Nested
    class Triggers {

        @Test
        void fiveFieldCronCountsAsTrigger() {
            assertThat(validator.validateTriggers(new Workflow(1, "wf", "*/5 * * * *", false))).isEmpty();
        }

        @Test
        void apiFlagCountsAsTrigger() {
            assertThat(validator.validateTriggers(new Workflow(1, "wf", null, true))).isEmpty();
        }

        @Test
        void invalidCronIsAWarningOnly() {
            TestWorkflows.Builder builder = TestWorkflows.workflow(1)
                    .node(1, NodeType.MAP, "mapping", TestWorkflows.map("a", 1));

            DagValidationResult result = validator.validate(new Workflow(1, "wf", "every tuesday", false),
                    builder.nodes(), builder.edges());

            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).containsExactly("invalid cron schedule: every tuesday");
        }

        @Test
        void fiveFieldCronGetsSecondsPrepended() {
            assertThat(DagValidator.toSpringCron(" 0 9 * * MON ")).isEqualTo("0 0 9 * * MON");
            assertThat(DagValidator.toSpringCron("0 0 9 * * MON")).isEqualTo("0 0 9 * * MON");
        }
    }
}
