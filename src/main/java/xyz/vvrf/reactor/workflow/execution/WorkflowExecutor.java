package xyz.vvrf.reactor.workflow.execution;

import xyz.vvrf.reactor.workflow.core.WorkflowDefinition;
import xyz.vvrf.reactor.workflow.core.WorkflowEdge;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;

import java.util.Collection;
import java.util.Map;

/**
 * 工作流执行器。每次调用创建一个运行，事件写入运行注册表。
 */
public interface WorkflowExecutor {

    /**
     * 同步执行：创建运行，按拓扑顺序执行到结束后返回运行 id。
     *
     * @param definition     工作流的节点和边
     * @param startingInputs 入口节点的输入
     * @param baseAdditions  追加到表达式 base 根中的值，可为空
     * @return 运行 id
     */
    String execute(WorkflowDefinition definition, Map<String, Object> startingInputs, Map<String, Object> baseAdditions);

    /**
     * 异步执行：创建运行后立即返回运行 id，执行在运行调度器上进行。
     */
    String start(WorkflowDefinition definition, Map<String, Object> startingInputs, Map<String, Object> baseAdditions);

    /**
     * 请求取消，在下一个节点开始前生效。
     */
    boolean cancel(String runId);

    default String execute(WorkflowDefinition definition, Map<String, Object> startingInputs) {
        return execute(definition, startingInputs, null);
    }

    default String execute(Collection<WorkflowNode> nodes, Collection<WorkflowEdge> edges, Map<String, Object> startingInputs) {
        return execute(WorkflowDefinition.of(nodes, edges), startingInputs, null);
    }

    default String start(WorkflowDefinition definition, Map<String, Object> startingInputs) {
        return start(definition, startingInputs, null);
    }
}
