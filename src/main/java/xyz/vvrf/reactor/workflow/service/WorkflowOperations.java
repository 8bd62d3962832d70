package xyz.vvrf.reactor.workflow.service;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.workflow.core.DagValidationResult;
import xyz.vvrf.reactor.workflow.core.PlannedNode;
import xyz.vvrf.reactor.workflow.core.WorkflowDefinition;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.exception.RunNotFoundException;
import xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException;
import xyz.vvrf.reactor.workflow.execution.WorkflowExecutor;
import xyz.vvrf.reactor.workflow.planning.AvailableDataResolver;
import xyz.vvrf.reactor.workflow.planning.ShapePlanner;
import xyz.vvrf.reactor.workflow.registry.NodeServiceRegistry;
import xyz.vvrf.reactor.workflow.repository.WorkflowRepository;
import xyz.vvrf.reactor.workflow.run.RunEventStream;
import xyz.vvrf.reactor.workflow.run.RunRegistry;
import xyz.vvrf.reactor.workflow.run.RunSignal;
import xyz.vvrf.reactor.workflow.run.RunSnapshot;
import xyz.vvrf.reactor.workflow.validation.DagValidator;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 对外暴露的工作流操作，不依赖任何传输层（HTTP、CLI 或进程内调用均可）。
 */
@Slf4j
public class WorkflowOperations {

    private final WorkflowRepository repository;
    private final NodeServiceRegistry nodeServiceRegistry;
    private final DagValidator validator;
    private final ShapePlanner planner;
    private final AvailableDataResolver dataResolver;
    private final WorkflowExecutor executor;
    private final RunRegistry runRegistry;
    private final RunEventStream eventStream;

    public WorkflowOperations(WorkflowRepository repository,
                              NodeServiceRegistry nodeServiceRegistry,
                              DagValidator validator,
                              ShapePlanner planner,
                              AvailableDataResolver dataResolver,
                              WorkflowExecutor executor,
                              RunRegistry runRegistry,
                              RunEventStream eventStream) {
        this.repository = repository;
        this.nodeServiceRegistry = nodeServiceRegistry;
        this.validator = validator;
        this.planner = planner;
        this.dataResolver = dataResolver;
        this.executor = executor;
        this.runRegistry = runRegistry;
        this.eventStream = eventStream;
    }

    /**
     * 结构校验加触发器检查。
     *
     * @throws WorkflowNotFoundException 工作流不存在
     */
    public DagValidationResult validateDag(long workflowId) {
        WorkflowDefinition definition = loadDefinition(workflowId);
        DagValidationResult result = validator.validate(
                definition.getWorkflow().orElse(null), definition.getNodes(), definition.getEdges());
        log.debug("DAG '{}': {} error(s), {} warning(s)", workflowId, result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    /**
     * @throws IllegalStateException 图未通过结构校验
     */
    public List<PlannedNode> planWorkflow(long workflowId, Map<String, Object> startingInputs) {
        WorkflowDefinition definition = loadDefinition(workflowId);
        return planner.plan(definition.getNodes(), definition.getEdges(), startingInputs);
    }

    public Map<Long, Map<String, Object>> availableDataMap(long workflowId) {
        WorkflowDefinition definition = loadDefinition(workflowId);
        return dataResolver.availableDataMap(definition.getNodes(), definition.getEdges(), Collections.emptyMap());
    }

    /**
     * 单个节点的配置校验。
     *
     * @throws xyz.vvrf.reactor.workflow.exception.NodeValidationException 配置不合法
     */
    public void validateNode(WorkflowNode node) {
        nodeServiceRegistry.requireService(node.getNodeType()).validate(node.getMetadata(), node.getStructuredOutput());
    }

    /**
     * 异步启动运行，立即返回运行 id。
     */
    public String runWorkflow(long workflowId, Map<String, Object> startingInputs) {
        WorkflowDefinition definition = loadDefinition(workflowId);
        String runId = executor.start(definition, startingInputs == null ? Collections.emptyMap() : startingInputs);
        log.info("[RunId: {}][Workflow: {}] 运行已提交", runId, workflowId);
        return runId;
    }

    public Flux<RunSignal> streamRun(String runId) {
        requireRun(runId);
        return eventStream.stream(runId);
    }

    public boolean cancelRun(String runId) {
        requireRun(runId);
        return executor.cancel(runId);
    }

    public RunSnapshot getRun(String runId) {
        return runRegistry.get(runId)
                .map(RunSnapshot::of)
                .orElseThrow(() -> new RunNotFoundException(runId));
    }

    private void requireRun(String runId) {
        if (!runRegistry.get(runId).isPresent()) {
            throw new RunNotFoundException(runId);
        }
    }

    private WorkflowDefinition loadDefinition(long workflowId) {
        return repository.findDefinition(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }
}
