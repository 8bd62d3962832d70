package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.workflow.core.*;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException;
import xyz.vvrf.reactor.workflow.expression.BaseValues;
import xyz.vvrf.reactor.workflow.monitor.RunMonitorListener;
import xyz.vvrf.reactor.workflow.node.MetadataBinder;
import xyz.vvrf.reactor.workflow.node.action.ForEachNodeService;
import xyz.vvrf.reactor.workflow.node.action.IfElseNodeService;
import xyz.vvrf.reactor.workflow.node.action.ReturnNodeService;
import xyz.vvrf.reactor.workflow.node.metadata.ForEachMetadata;
import xyz.vvrf.reactor.workflow.planning.AvailableDataResolver;
import xyz.vvrf.reactor.workflow.planning.UnionMerger;
import xyz.vvrf.reactor.workflow.run.RunKind;
import xyz.vvrf.reactor.workflow.run.RunRegistry;
import xyz.vvrf.reactor.workflow.run.RunState;
import xyz.vvrf.reactor.workflow.run.RunStatus;
import xyz.vvrf.reactor.workflow.validation.DagValidator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * WorkflowExecutor 的标准实现。
 * <p>
 * 每个运行在一个线程上按拓扑顺序逐个执行节点：
 * <ol>
 *     <li>检查取消标记</li>
 *     <li>判断节点是否可达：任一父节点失败（skip 策略）则跳过并发出 node_skipped；
 *     没有任何激活的入边（if_else 未命中的分支）则发出 branch_skipped</li>
 *     <li>用已执行祖先的真实输出合并出输入（入口节点使用 starting_inputs）</li>
 *     <li>发出 node_start，通过 {@link NodeInvoker} 执行，成功发出 node_output，失败按 on_error 处理</li>
 * </ol>
 * for_each 的所有后代构成循环体，每个元素顺序执行一次；workflow 节点在同一运行内执行子工作流。
 * 结束时发出 run_summary，然后设置 finished_at。
 */
@Slf4j
public class StandardWorkflowExecutor implements WorkflowExecutor {

    public static final int DEFAULT_MAX_SUB_WORKFLOW_DEPTH = 8;

    private final DagValidator validator;
    private final AvailableDataResolver dataResolver;
    private final NodeInvoker nodeInvoker;
    private final MetadataBinder metadataBinder;
    private final RunRegistry runRegistry;
    private final SubWorkflowResolver subWorkflowResolver;
    private final Scheduler runScheduler;
    private final Clock clock;
    private final int maxSubWorkflowDepth;
    private final List<RunMonitorListener> monitorListeners;

    public StandardWorkflowExecutor(DagValidator validator,
                                    AvailableDataResolver dataResolver,
                                    NodeInvoker nodeInvoker,
                                    MetadataBinder metadataBinder,
                                    RunRegistry runRegistry,
                                    SubWorkflowResolver subWorkflowResolver,
                                    Scheduler runScheduler,
                                    Clock clock,
                                    int maxSubWorkflowDepth,
                                    List<RunMonitorListener> monitorListeners) {
        this.validator = Objects.requireNonNull(validator, "DagValidator 不能为空");
        this.dataResolver = Objects.requireNonNull(dataResolver, "AvailableDataResolver 不能为空");
        this.nodeInvoker = Objects.requireNonNull(nodeInvoker, "NodeInvoker 不能为空");
        this.metadataBinder = Objects.requireNonNull(metadataBinder, "MetadataBinder 不能为空");
        this.runRegistry = Objects.requireNonNull(runRegistry, "RunRegistry 不能为空");
        this.subWorkflowResolver = subWorkflowResolver == null ? SubWorkflowResolver.none() : subWorkflowResolver;
        this.runScheduler = Objects.requireNonNull(runScheduler, "运行调度器不能为空");
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
        this.maxSubWorkflowDepth = maxSubWorkflowDepth;
        this.monitorListeners = monitorListeners == null ? Collections.emptyList() : monitorListeners;
    }

    @Override
    public String execute(WorkflowDefinition definition, Map<String, Object> startingInputs, Map<String, Object> baseAdditions) {
        RunState state = runRegistry.create(RunKind.WORKFLOW, definition.getWorkflowId());
        runInternal(state, definition, startingInputs, baseAdditions);
        return state.getRunId();
    }

    @Override
    public String start(WorkflowDefinition definition, Map<String, Object> startingInputs, Map<String, Object> baseAdditions) {
        RunState state = runRegistry.create(RunKind.WORKFLOW, definition.getWorkflowId());
        Mono.fromRunnable(() -> runInternal(state, definition, startingInputs, baseAdditions))
                .subscribeOn(runScheduler)
                .subscribe(
                        null,
                        error -> log.error("[RunId: {}] 运行在调度器上意外终止: {}", state.getRunId(), error.getMessage(), error));
        return state.getRunId();
    }

    @Override
    public boolean cancel(String runId) {
        return runRegistry.cancel(runId);
    }

    private void runInternal(RunState state, WorkflowDefinition definition,
                             Map<String, Object> startingInputs, Map<String, Object> baseAdditions) {
        final String runId = state.getRunId();
        final long workflowId = definition.getWorkflowId();
        RunExecutionContext ctx = new RunExecutionContext(state, runRegistry, clock);
        runRegistry.markRunning(runId);
        Instant startTime = clock.instant();
        RunStatus status;

        try {
            WorkflowGraph graph = definition.toGraph();
            DagValidationResult validation = validator.validate(graph);
            if (!validation.isValid()) {
                log.warn("[RunId: {}][Workflow: {}] 工作流图未通过校验，运行失败: {}", runId, workflowId, validation.getErrors());
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("workflow_id", workflowId);
                data.put("errors", validation.getErrors());
                ctx.error("graph_invalid", data);
                status = RunStatus.FAILED;
            } else {
                log.info("[RunId: {}][Workflow: {}] 开始执行，拓扑顺序: {}", runId, workflowId, validation.getTopoOrder());
                safeNotifyListeners(l -> l.onRunStart(runId, workflowId, graph.getNodeIds().size()));
                RunScope scope = new RunScope(runId, workflowId, 0,
                        BaseValues.forRun(clock, runId, baseAdditions),
                        (childId, inputs, parentScope) -> runSubWorkflow(ctx, childId, inputs, parentScope));
                new GraphExecution(ctx, graph, validation.getTopoOrder(), startingInputs, scope).run();
                status = RunStatus.SUCCEEDED;
            }
        } catch (RunCancelledException e) {
            log.info("[RunId: {}][Workflow: {}] 运行已取消", runId, workflowId);
            status = RunStatus.FAILED;
        } catch (RunAbortedException e) {
            log.warn("[RunId: {}][Workflow: {}] 运行因节点 {} 失败而终止", runId, workflowId, e.getFailedNode().getId());
            status = RunStatus.FAILED;
        } catch (RuntimeException e) {
            log.error("[RunId: {}][Workflow: {}] 运行期间发生意外错误: {}", runId, workflowId, e.getMessage(), e);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("workflow_id", workflowId);
            data.put("error", String.valueOf(e.getMessage()));
            ctx.error("run_error", data);
            status = RunStatus.FAILED;
        }

        Duration totalDuration = Duration.between(startTime, clock.instant());
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("workflow_id", workflowId);
        summary.put("status", status.getKey());
        summary.putAll(ctx.counters());
        summary.put("duration_ms", totalDuration.toMillis());
        if (status == RunStatus.SUCCEEDED) {
            ctx.info("run_summary", summary);
        } else {
            ctx.error("run_summary", summary);
        }
        runRegistry.finish(runId, status);

        final RunStatus finalStatus = status;
        safeNotifyListeners(l -> l.onRunComplete(runId, workflowId, finalStatus, totalDuration));
    }

    /**
     * 在当前运行内执行子工作流，返回其 return 节点的 payload（对象原样返回，其它值包装为 {"result": v}），
     * 没有 return 节点时返回所有末端节点输出的合并。
     */
    private Map<String, Object> runSubWorkflow(RunExecutionContext ctx, long workflowId,
                                               Map<String, Object> inputs, RunScope parentScope) {
        if (parentScope.getDepth() >= maxSubWorkflowDepth) {
            throw new NodeExecutionException("sub-workflow nesting exceeds max depth " + maxSubWorkflowDepth);
        }
        WorkflowDefinition definition = subWorkflowResolver.findDefinition(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        WorkflowGraph graph = definition.toGraph();
        DagValidationResult validation = validator.validate(graph);
        if (!validation.isValid()) {
            throw new NodeExecutionException("sub-workflow " + workflowId + " is invalid: " + validation.getErrors());
        }

        RunScope childScope = parentScope.child(workflowId);
        log.debug("[RunId: {}][Workflow: {}] 进入子工作流 (深度: {})", ctx.getRunId(), workflowId, childScope.getDepth());
        GraphExecution execution = new GraphExecution(ctx, graph, validation.getTopoOrder(), inputs, childScope);
        try {
            execution.run();
        } catch (RunAbortedException e) {
            throw new NodeExecutionException(String.format("sub-workflow %d failed at node %d: %s",
                    workflowId, e.getFailedNode().getId(), e.getCause().getMessage()), e.getCause());
        }
        return execution.result();
    }

    private enum NodeState {
        EXECUTED,
        FAILED,
        BRANCH_SKIPPED,
        UPSTREAM_SKIPPED
    }

    /**
     * 一个图（顶层工作流、子工作流或一次循环迭代）的执行状态。
     * 循环迭代从外层复制状态，迭代内的输出不回写外层。
     */
    private final class GraphExecution {

        private final RunExecutionContext ctx;
        private final WorkflowGraph graph;
        private final List<Long> topoOrder;
        private final Map<String, Object> startingInputs;
        private final RunScope scope;
        private final Map<Long, Map<String, Object>> outputs;
        private final Map<Long, NodeState> states;
        private final Map<Long, Boolean> branchTaken;
        private final Object item;
        private final Integer index;

        GraphExecution(RunExecutionContext ctx, WorkflowGraph graph, List<Long> topoOrder,
                       Map<String, Object> startingInputs, RunScope scope) {
            this(ctx, graph, topoOrder, startingInputs, scope, new HashMap<>(), new HashMap<>(), new HashMap<>(), null, null);
        }

        private GraphExecution(RunExecutionContext ctx, WorkflowGraph graph, List<Long> topoOrder,
                               Map<String, Object> startingInputs, RunScope scope,
                               Map<Long, Map<String, Object>> outputs, Map<Long, NodeState> states,
                               Map<Long, Boolean> branchTaken, Object item, Integer index) {
            this.ctx = ctx;
            this.graph = graph;
            this.topoOrder = topoOrder;
            this.startingInputs = startingInputs == null ? Collections.emptyMap() : startingInputs;
            this.scope = scope;
            this.outputs = outputs;
            this.states = states;
            this.branchTaken = branchTaken;
            this.item = item;
            this.index = index;
        }

        GraphExecution forIteration(Object currentItem, int currentIndex) {
            return new GraphExecution(ctx, graph, topoOrder, startingInputs, scope,
                    new HashMap<>(outputs), new HashMap<>(states), new HashMap<>(branchTaken),
                    currentItem, currentIndex);
        }

        void run() {
            runNodes(topoOrder);
        }

        private void runNodes(List<Long> nodeIds) {
            Set<Long> handled = new HashSet<>();
            for (Long nodeId : nodeIds) {
                if (handled.contains(nodeId)) {
                    continue;
                }
                checkCancelled();
                WorkflowNode node = graph.getNode(nodeId);

                NodeState gate = gate(nodeId);
                if (gate != null) {
                    skip(node, gate);
                    continue;
                }

                List<Long> loopBody = Collections.emptyList();
                if (node.getNodeType() == NodeType.FOR_EACH) {
                    Set<Long> descendants = graph.getDescendants(nodeId);
                    loopBody = nodeIds.stream().filter(descendants::contains).collect(Collectors.toList());
                    handled.addAll(loopBody);
                }

                NodeInput input = buildInput(node);
                ctx.info("node_start", nodeData(node));
                NodeResult result = nodeInvoker.invoke(node, input).block();
                if (result == null) {
                    result = NodeResult.failure(new NodeExecutionException(node.getId(), node.getNodeType(), "node produced no result", null));
                }

                if (result.isSuccess()) {
                    Map<String, Object> output = result.getOutput();
                    if (node.getNodeType() == NodeType.FOR_EACH) {
                        output = runLoop(node, output, loopBody);
                    }
                    recordSuccess(node, output);
                } else {
                    handleFailure(node, result.getError().orElseThrow(IllegalStateException::new), loopBody);
                }
            }
        }

        /**
         * @return null 表示节点应当执行，否则为跳过原因
         */
        private NodeState gate(long nodeId) {
            List<WorkflowEdge> incoming = graph.getIncomingEdges(nodeId);
            if (incoming.isEmpty()) {
                return null;
            }
            boolean anyActive = false;
            for (WorkflowEdge edge : incoming) {
                NodeState parentState = states.get(edge.getParentId());
                if (parentState == NodeState.FAILED || parentState == NodeState.UPSTREAM_SKIPPED) {
                    return NodeState.UPSTREAM_SKIPPED;
                }
                if (parentState == NodeState.EXECUTED && isActive(edge)) {
                    anyActive = true;
                }
            }
            return anyActive ? null : NodeState.BRANCH_SKIPPED;
        }

        private boolean isActive(WorkflowEdge edge) {
            WorkflowNode parent = graph.getNode(edge.getParentId());
            if (parent.getNodeType() != NodeType.IF_ELSE) {
                return true;
            }
            Boolean taken = branchTaken.get(parent.getId());
            return taken != null && String.valueOf(taken).equals(edge.getBranchLabel());
        }

        private void skip(WorkflowNode node, NodeState reason) {
            states.put(node.getId(), reason);
            ctx.nodeSkipped();
            Map<String, Object> data = nodeData(node);
            String message;
            if (reason == NodeState.BRANCH_SKIPPED) {
                message = "branch_skipped";
                ctx.info(message, data);
            } else {
                message = "node_skipped";
                data.put("reason", "upstream node failed");
                ctx.warn(message, data);
            }
            log.debug("[RunId: {}][Workflow: {}] 节点 {} 被跳过: {}", ctx.getRunId(), scope.getWorkflowId(), node.getId(), message);
            safeNotifyListeners(l -> l.onNodeSkipped(ctx.getRunId(), scope.getWorkflowId(), node, message));
        }

        private NodeInput buildInput(WorkflowNode node) {
            long nodeId = node.getId();
            Map<String, Object> data;
            if (graph.inDegree(nodeId) == 0) {
                data = startingInputs;
            } else {
                UnionMerger.Result merged = dataResolver.resolve(nodeId, graph, topoOrder, outputs);
                if (!merged.getNotes().isEmpty()) {
                    log.debug("[RunId: {}][Workflow: {}] 节点 {} 的输入合并存在冲突: {}",
                            ctx.getRunId(), scope.getWorkflowId(), nodeId, merged.getNotes());
                }
                data = merged.getMerged();
            }

            List<Long> parents = graph.getParents(nodeId);
            Map<Long, Map<String, Object>> parentOutputs = new LinkedHashMap<>();
            for (Long parentId : parents) {
                if (outputs.containsKey(parentId)) {
                    parentOutputs.put(parentId, outputs.get(parentId));
                }
            }
            NodeInput input = NodeInput.of(data, parentOutputs, UnionMerger.inTopoOrder(parents, topoOrder, outputs), scope);
            return index != null ? input.withIteration(item, index) : input;
        }

        private Map<String, Object> runLoop(WorkflowNode forEachNode, Map<String, Object> output, List<Long> body) {
            Object selected = output.get(ForEachNodeService.ITEMS);
            List<?> items = selected instanceof List ? (List<?>) selected : Collections.emptyList();
            boolean flatten = !Boolean.FALSE.equals(
                    metadataBinder.bindLenient(forEachNode.getMetadata(), ForEachMetadata.class).getFlatten());
            List<Long> sinks = body.stream().filter(id -> graph.outDegree(id) == 0).collect(Collectors.toList());

            // 循环体内看到的 for_each 输出是待迭代的数组
            outputs.put(forEachNode.getId(), output);
            states.put(forEachNode.getId(), NodeState.EXECUTED);

            log.debug("[RunId: {}][Workflow: {}] for_each 节点 {} 开始迭代 {} 个元素，循环体: {}",
                    ctx.getRunId(), scope.getWorkflowId(), forEachNode.getId(), items.size(), body);
            List<Object> results = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                checkCancelled();
                GraphExecution iteration = forIteration(items.get(i), i);
                iteration.runNodes(body);
                List<Map<String, Object>> sinkOutputs = new ArrayList<>();
                for (Long sinkId : sinks) {
                    if (iteration.states.get(sinkId) == NodeState.EXECUTED) {
                        sinkOutputs.add(iteration.outputs.get(sinkId));
                    }
                }
                if (flatten) {
                    results.addAll(sinkOutputs);
                } else {
                    results.add(sinkOutputs);
                }
            }

            Map<String, Object> loopOutput = new LinkedHashMap<>();
            loopOutput.put(ForEachNodeService.ITEMS_PROCESSED, items.size());
            loopOutput.put(ForEachNodeService.RESULTS, results);
            return loopOutput;
        }

        private void recordSuccess(WorkflowNode node, Map<String, Object> output) {
            outputs.put(node.getId(), output);
            states.put(node.getId(), NodeState.EXECUTED);
            if (node.getNodeType() == NodeType.IF_ELSE) {
                Object condition = output.get(IfElseNodeService.CONDITION_RESULT);
                if (condition instanceof Boolean) {
                    branchTaken.put(node.getId(), (Boolean) condition);
                }
            }
            ctx.nodeExecuted();
            Map<String, Object> data = nodeData(node);
            data.put("output", output);
            ctx.info("node_output", data);
        }

        private void handleFailure(WorkflowNode node, Throwable error, List<Long> loopBody) {
            if (error instanceof RunCancelledException || (ctx.isCancelRequested() && ctx.isCancellationReported())) {
                throw new RunCancelledException(ctx.getRunId());
            }
            OnErrorPolicy policy = metadataBinder.bindCommon(node.getMetadata()).effectiveOnError();
            Map<String, Object> data = nodeData(node);
            data.put("error", String.valueOf(error.getMessage()));
            data.put("error_type", error.getClass().getSimpleName());
            data.put("on_error", policy.getKey());
            ctx.nodeFailed();

            switch (policy) {
                case CONTINUE:
                    ctx.warn("node_error", data);
                    skipLoopBody(loopBody);
                    recordSuccess(node, new LinkedHashMap<>());
                    break;
                case SKIP:
                    ctx.error("node_error", data);
                    states.put(node.getId(), NodeState.FAILED);
                    skipLoopBody(loopBody);
                    break;
                case FAIL:
                default:
                    ctx.error("node_error", data);
                    states.put(node.getId(), NodeState.FAILED);
                    throw new RunAbortedException(node, error);
            }
        }

        private void skipLoopBody(List<Long> loopBody) {
            for (Long bodyId : loopBody) {
                skip(graph.getNode(bodyId), NodeState.UPSTREAM_SKIPPED);
            }
        }

        private void checkCancelled() {
            if (ctx.isCancelRequested()) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("workflow_id", scope.getWorkflowId());
                data.put("note", "run cancelled before next node");
                ctx.reportCancelled(data);
                throw new RunCancelledException(ctx.getRunId());
            }
        }

        private Map<String, Object> nodeData(WorkflowNode node) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("node_id", node.getId());
            data.put("node_type", node.getNodeType().getKey());
            data.put("workflow_id", scope.getWorkflowId());
            if (scope.getDepth() > 0) {
                data.put("depth", scope.getDepth());
            }
            if (index != null) {
                data.put("index", index);
            }
            return data;
        }

        /**
         * 子工作流的返回值。
         */
        Map<String, Object> result() {
            for (Long nodeId : topoOrder) {
                WorkflowNode node = graph.getNode(nodeId);
                if (node.getNodeType() == NodeType.RETURN && states.get(nodeId) == NodeState.EXECUTED) {
                    Object payload = outputs.get(nodeId).get(ReturnNodeService.PAYLOAD);
                    if (payload instanceof Map) {
                        Map<String, Object> result = new LinkedHashMap<>();
                        ((Map<?, ?>) payload).forEach((key, value) -> result.put(String.valueOf(key), value));
                        return result;
                    }
                    Map<String, Object> wrapped = new LinkedHashMap<>();
                    wrapped.put("result", payload);
                    return wrapped;
                }
            }
            Map<Long, Map<String, Object>> sinkOutputs = new LinkedHashMap<>();
            for (Long nodeId : topoOrder) {
                if (graph.outDegree(nodeId) == 0 && states.get(nodeId) == NodeState.EXECUTED) {
                    sinkOutputs.put(nodeId, outputs.get(nodeId));
                }
            }
            return UnionMerger.merge(sinkOutputs).getMerged();
        }
    }

    private void safeNotifyListeners(Consumer<RunMonitorListener> notification) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (RunMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("运行监控监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
