package xyz.vvrf.reactor.workflow.node.action;

import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.core.RunScope;
import xyz.vvrf.reactor.workflow.node.AbstractNodeService;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.metadata.WorkflowCallMetadata;
import xyz.vvrf.reactor.workflow.util.Shapes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * workflow：在当前运行内同步执行另一个工作流。
 * 子工作流的返回值是对象时直接作为输出，否则包装为 {"result": value}。
 * propagate_identity 为 false 时，base 中的 identity 不传给子工作流。
 */
@NodeServiceType(NodeType.WORKFLOW)
public class WorkflowCallNodeService extends AbstractNodeService<WorkflowCallMetadata> {

    public static final String IDENTITY_KEY = "identity";

    public WorkflowCallNodeService(NodeServiceSupport support) {
        super(NodeType.WORKFLOW, WorkflowCallMetadata.class, support);
    }

    @Override
    protected void validateMetadata(WorkflowCallMetadata metadata) {
        checkExpressionMap(metadata.getInputMapping(), "input_mapping");
    }

    @Override
    protected Map<String, Object> planShape(WorkflowCallMetadata metadata, Map<String, Object> inputShape) {
        return shape("result", Shapes.UNKNOWN);
    }

    @Override
    protected Map<String, Object> executeNode(NodeInput input, WorkflowCallMetadata metadata) {
        Map<String, Object> childInputs = metadata.getInputMapping() == null
                ? new LinkedHashMap<>(input.getData())
                : evaluateMap(metadata.getInputMapping(), input, "input_mapping");

        RunScope scope = input.getScope();
        if (Boolean.FALSE.equals(metadata.getPropagateIdentity())) {
            scope = scope.withoutBaseKey(IDENTITY_KEY);
        }
        Map<String, Object> result = scope.getSubWorkflowRunner().run(metadata.getWorkflowId(), childInputs, scope);
        return result == null ? new LinkedHashMap<>() : new LinkedHashMap<>(result);
    }
}
