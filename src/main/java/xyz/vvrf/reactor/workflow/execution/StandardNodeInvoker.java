package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;
import xyz.vvrf.reactor.workflow.core.*;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.monitor.RunMonitorListener;
import xyz.vvrf.reactor.workflow.node.MetadataBinder;
import xyz.vvrf.reactor.workflow.node.metadata.CommonMetadata;
import xyz.vvrf.reactor.workflow.registry.NodeServiceRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * NodeInvoker 的标准实现。
 * 获取节点实现，应用超时/重试（节点 metadata 中的 timeout_ms / retry 优先），
 * 在节点调度器上执行节点逻辑，并处理结果/错误。
 */
@Slf4j
public class StandardNodeInvoker implements NodeInvoker {

    private final NodeServiceRegistry registry;
    private final MetadataBinder metadataBinder;
    private final Duration defaultNodeTimeout;
    private final Scheduler nodeExecutionScheduler;
    private final RetryBackoffSpec retryTemplate;
    private final List<RunMonitorListener> monitorListeners;

    /**
     * @param registry               节点实现注册表
     * @param metadataBinder         读取公共 metadata 字段
     * @param defaultNodeTimeout     节点的全局默认超时时间
     * @param nodeExecutionScheduler 节点执行的 Reactor Scheduler
     * @param retryTemplate          重试的退避策略，次数由节点的 retry 字段决定
     * @param monitorListeners       监控监听器列表
     */
    public StandardNodeInvoker(NodeServiceRegistry registry,
                               MetadataBinder metadataBinder,
                               Duration defaultNodeTimeout,
                               Scheduler nodeExecutionScheduler,
                               RetryBackoffSpec retryTemplate,
                               List<RunMonitorListener> monitorListeners) {
        this.registry = Objects.requireNonNull(registry, "NodeServiceRegistry 不能为空");
        this.metadataBinder = Objects.requireNonNull(metadataBinder, "MetadataBinder 不能为空");
        this.defaultNodeTimeout = Objects.requireNonNull(defaultNodeTimeout, "默认节点超时不能为空");
        this.nodeExecutionScheduler = Objects.requireNonNull(nodeExecutionScheduler, "节点执行调度器不能为空");
        this.retryTemplate = Objects.requireNonNull(retryTemplate, "重试策略不能为空");
        this.monitorListeners = monitorListeners == null ? Collections.emptyList() : monitorListeners;
        log.info("StandardNodeInvoker 已初始化。默认超时: {}, 监听器数量: {}", defaultNodeTimeout, this.monitorListeners.size());
    }

    @Override
    public Mono<NodeResult> invoke(WorkflowNode node, NodeInput input) {
        final String runId = input.getScope().getRunId();
        final long workflowId = input.getScope().getWorkflowId();

        return Mono.defer(() -> {
                    NodeService service = registry.requireService(node.getNodeType());
                    CommonMetadata common = metadataBinder.bindCommon(node.getMetadata());
                    Duration timeout = determineEffectiveTimeout(common, service);
                    int retries = common.getRetry() == null ? 0 : common.getRetry();
                    Instant startTime = Instant.now();

                    safeNotifyListeners(l -> l.onNodeStart(runId, workflowId, node));
                    log.debug("[RunId: {}][Workflow: {}] 执行节点 {} (类型: {}, 超时: {}, 重试: {})",
                            runId, workflowId, node.getId(), node.getNodeType(), timeout, retries);

                    return executeInternal(service, node, input, timeout, retries, runId, workflowId, startTime);
                })
                .onErrorResume(error -> {
                    // 预执行设置阶段的错误，例如注册表查找失败
                    log.error("[RunId: {}][Workflow: {}] 节点 {} 在预执行设置期间失败: {}",
                            runId, workflowId, node.getId(), error.getMessage(), error);
                    safeNotifyListeners(l -> l.onNodeFailure(runId, workflowId, node, Duration.ZERO, error));
                    return Mono.just(NodeResult.failure(error));
                });
    }

    /**
     * 优先级：节点 timeout_ms -> 节点类型默认 -> 全局默认。
     */
    private Duration determineEffectiveTimeout(CommonMetadata common, NodeService service) {
        if (common.getTimeoutMs() != null && common.getTimeoutMs() > 0) {
            return Duration.ofMillis(common.getTimeoutMs());
        }
        Duration typeDefault = service.getExecutionTimeout();
        return (typeDefault != null && !typeDefault.isZero() && !typeDefault.isNegative())
                ? typeDefault
                : defaultNodeTimeout;
    }

    private Mono<NodeResult> executeInternal(NodeService service,
                                             WorkflowNode node,
                                             NodeInput input,
                                             Duration timeout,
                                             int retries,
                                             String runId,
                                             long workflowId,
                                             Instant startTime) {
        NodeInput nodeInput = input.withStructuredOutput(node.getStructuredOutput());

        Mono<Map<String, Object>> attempt = Mono.fromCallable(() -> service.execute(nodeInput, node.getMetadata()))
                .subscribeOn(nodeExecutionScheduler)
                .timeout(timeout)
                .doOnError(error -> {
                    if (error instanceof TimeoutException) {
                        log.warn("[RunId: {}][Workflow: {}] 节点 {} 执行尝试在 {} 后超时。", runId, workflowId, node.getId(), timeout);
                        safeNotifyListeners(l -> l.onNodeTimeout(runId, workflowId, node, timeout));
                    } else {
                        log.warn("[RunId: {}][Workflow: {}] 节点 {} 执行尝试因异常失败: {}", runId, workflowId, node.getId(), error.getMessage());
                    }
                });
        if (retries > 0) {
            // 重试耗尽后抛出最后一次的原始错误
            Retry retrySpec = retryTemplate.maxAttempts(retries)
                    .filter(error -> !(error instanceof NodeValidationException) && !(error instanceof RunCancelledException))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure());
            attempt = attempt.retryWhen(retrySpec);
        }

        return attempt
                .defaultIfEmpty(Collections.emptyMap())
                .map(output -> {
                    NodeResult result = NodeResult.success(output);
                    Duration duration = Duration.between(startTime, Instant.now());
                    log.debug("[RunId: {}][Workflow: {}] 节点 {} 执行成功，耗时 {}ms", runId, workflowId, node.getId(), duration.toMillis());
                    safeNotifyListeners(l -> l.onNodeSuccess(runId, workflowId, node, duration, result));
                    return result;
                })
                .onErrorResume(error -> {
                    Throwable failure = wrap(node, error, timeout);
                    Duration duration = Duration.between(startTime, Instant.now());
                    log.error("[RunId: {}][Workflow: {}] 节点 {} 执行在重试/超时后最终失败: {}",
                            runId, workflowId, node.getId(), failure.getMessage(), failure);
                    safeNotifyListeners(l -> l.onNodeFailure(runId, workflowId, node, duration, failure));
                    return Mono.just(NodeResult.failure(failure));
                });
    }

    /**
     * 超时转换为带节点信息的 NodeExecutionException，框架自身的异常原样保留。
     */
    private Throwable wrap(WorkflowNode node, Throwable error, Duration timeout) {
        if (error instanceof TimeoutException) {
            return new NodeExecutionException(node.getId(), node.getNodeType(),
                    "execution timed out after " + timeout.toMillis() + "ms", error);
        }
        return error;
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
