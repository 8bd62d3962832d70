package xyz.vvrf.reactor.workflow.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;
import xyz.vvrf.reactor.workflow.execution.NodeInvoker;
import xyz.vvrf.reactor.workflow.execution.StandardNodeInvoker;
import xyz.vvrf.reactor.workflow.execution.StandardWorkflowExecutor;
import xyz.vvrf.reactor.workflow.execution.WorkflowExecutor;
import xyz.vvrf.reactor.workflow.expression.ExpressionEvaluator;
import xyz.vvrf.reactor.workflow.expression.SpelExpressionEvaluator;
import xyz.vvrf.reactor.workflow.expression.TemplateRenderer;
import xyz.vvrf.reactor.workflow.monitor.LoggingRunMonitorListener;
import xyz.vvrf.reactor.workflow.monitor.MicrometerRunMonitorListener;
import xyz.vvrf.reactor.workflow.monitor.RunMonitorListener;
import xyz.vvrf.reactor.workflow.node.MetadataBinder;
import xyz.vvrf.reactor.workflow.node.NodeServiceSupport;
import xyz.vvrf.reactor.workflow.node.client.CompletionClient;
import xyz.vvrf.reactor.workflow.node.client.EmbeddingClient;
import xyz.vvrf.reactor.workflow.node.client.GuruClient;
import xyz.vvrf.reactor.workflow.node.client.HttpResourceClient;
import xyz.vvrf.reactor.workflow.node.client.VectorStoreClient;
import xyz.vvrf.reactor.workflow.node.client.WebClientHttpResourceClient;
import xyz.vvrf.reactor.workflow.node.resource.HttpAuthPresets;
import xyz.vvrf.reactor.workflow.planning.AvailableDataResolver;
import xyz.vvrf.reactor.workflow.planning.ShapePlanner;
import xyz.vvrf.reactor.workflow.registry.NodeServiceRegistry;
import xyz.vvrf.reactor.workflow.registry.SpringScanningNodeServiceRegistry;
import xyz.vvrf.reactor.workflow.repository.InMemoryWorkflowRepository;
import xyz.vvrf.reactor.workflow.repository.WorkflowRepository;
import xyz.vvrf.reactor.workflow.run.RunEventStream;
import xyz.vvrf.reactor.workflow.run.RunRegistry;
import xyz.vvrf.reactor.workflow.service.WorkflowOperations;
import xyz.vvrf.reactor.workflow.validation.DagValidator;

import javax.validation.Validation;
import javax.validation.Validator;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * 工作流框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link WorkflowFrameworkProperties}。
 * 2. 提供节点执行、运行和表达式求值三个 {@link Scheduler}，节点执行调度器可由属性配置。
 * 3. 提供节点重试使用的 {@link RetryBackoffSpec} ("workflowRetryBackoffSpec")。
 * 4. 扫描内置节点实现并由 {@link SpringScanningNodeServiceRegistry} 注册，启动时校验 15 种类型齐全。
 * 5. 组装校验器、规划器、执行器、运行注册表和 {@link WorkflowOperations}。
 * <p>
 * AI 和检索类节点依赖的客户端默认未配置，调用时抛出异常；应用提供同类型的 Bean 即可替换。
 * 所有 Bean 都带 {@link ConditionalOnMissingBean}。
 */
@Configuration
@EnableConfigurationProperties(WorkflowFrameworkProperties.class)
@AutoConfigureAfter(value = {JacksonAutoConfiguration.class, ValidationAutoConfiguration.class},
        name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ComponentScan(basePackages = "xyz.vvrf.reactor.workflow.node")
@Slf4j
public class WorkflowFrameworkAutoConfiguration {

    private final ApplicationContext applicationContext;

    public WorkflowFrameworkAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("工作流框架自动配置 (WorkflowFrameworkAutoConfiguration) 已加载。");
    }

    // ---------------------------------------------------------------- 调度与重试

    /**
     * 节点执行调度器，类型和参数由 {@link WorkflowFrameworkProperties.SchedulerProps} 配置。
     */
    @Bean(name = "workflowNodeExecutionScheduler", destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "workflowNodeExecutionScheduler")
    public Scheduler workflowNodeExecutionScheduler(WorkflowFrameworkProperties properties) {
        WorkflowFrameworkProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case BOUNDED_ELASTIC:
                WorkflowFrameworkProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
                log.info("正在创建 'workflowNodeExecutionScheduler' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        namePrefix, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
                return newBoundedElastic(schedulerProps, namePrefix);
            case PARALLEL:
                WorkflowFrameworkProperties.ParallelProps pProps = schedulerProps.getParallel();
                log.info("正在创建 'workflowNodeExecutionScheduler' (Parallel): prefix={}, parallelism={}", namePrefix, pProps.getParallelism());
                return newBlockingFixedScheduler(namePrefix, pProps.getParallelism());
            case SINGLE:
                log.info("正在创建 'workflowNodeExecutionScheduler' (Single): prefix={}", namePrefix);
                return newBlockingFixedScheduler(namePrefix, 1);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'workflow.scheduler.type=CUSTOM' 但 'workflow.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback");
                }
                log.info("正在从 Spring 上下文获取自定义节点执行调度器，名称: {}", customBeanName);
                try {
                    return applicationContext.getBean(customBeanName, Scheduler.class);
                } catch (Exception e) {
                    log.error("获取自定义 Scheduler Bean '{}' 失败。回退到默认 BoundedElastic。", customBeanName, e);
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback-custom-failed");
                }
            default:
                log.warn("未知的 'workflow.scheduler.type': {}. 回退到默认 BoundedElastic。", schedulerProps.getType());
                return newBoundedElastic(schedulerProps, namePrefix + "-default");
        }
    }

    /**
     * 运行线程：每个运行在这里同步驱动，事件流的轮询和驱逐任务也在这里执行。
     */
    @Bean(name = "workflowRunScheduler", destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "workflowRunScheduler")
    public Scheduler workflowRunScheduler(WorkflowFrameworkProperties properties) {
        return newBoundedElastic(properties.getScheduler(), properties.getScheduler().getNamePrefix() + "-run");
    }

    @Bean(name = "workflowExpressionScheduler", destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "workflowExpressionScheduler")
    public Scheduler workflowExpressionScheduler(WorkflowFrameworkProperties properties) {
        return newBoundedElastic(properties.getScheduler(), properties.getScheduler().getNamePrefix() + "-expr");
    }

    /**
     * 节点重试的退避策略。尝试次数在执行时由节点的 retry 字段覆盖。
     */
    @Bean(name = "workflowRetryBackoffSpec")
    @ConditionalOnMissingBean(name = "workflowRetryBackoffSpec")
    public RetryBackoffSpec workflowRetryBackoffSpec(WorkflowFrameworkProperties properties) {
        WorkflowFrameworkProperties.RetryProps retryProps = properties.getRetry();
        Duration firstBackoff = retryProps.getFirstBackoff();
        if (firstBackoff == null || firstBackoff.isNegative() || firstBackoff.isZero()) {
            log.warn("Retry firstBackoff 配置无效 ({}). 将使用默认值 100ms.", firstBackoff);
            firstBackoff = Duration.ofMillis(100);
        }

        if (retryProps.isUseExponentialBackoff()) {
            log.debug("配置指数退避重试: minBackoff={}, maxBackoff={}, jitter={}",
                    firstBackoff, retryProps.getMaxBackoff(), retryProps.getJitterFactor());
            RetryBackoffSpec backoffSpec = Retry.backoff(0, firstBackoff);

            Duration maxBackoff = retryProps.getMaxBackoff();
            if (maxBackoff != null && !maxBackoff.isNegative() && !maxBackoff.isZero()) {
                backoffSpec = backoffSpec.maxBackoff(maxBackoff);
            }
            Double jitterFactor = retryProps.getJitterFactor();
            if (jitterFactor != null) {
                backoffSpec = backoffSpec.jitter(jitterFactor);
            }
            return backoffSpec;
        }
        log.debug("配置固定延迟重试: delay={}", firstBackoff);
        return Retry.fixedDelay(0, firstBackoff);
    }

    @Bean(name = "workflowClock")
    @ConditionalOnMissingBean(Clock.class)
    public Clock workflowClock() {
        return Clock.systemUTC();
    }

    // ---------------------------------------------------------------- 表达式与 metadata

    @Bean
    @ConditionalOnMissingBean(ExpressionEvaluator.class)
    public ExpressionEvaluator expressionEvaluator(WorkflowFrameworkProperties properties,
                                                   @Qualifier("workflowExpressionScheduler") Scheduler expressionScheduler) {
        return new SpelExpressionEvaluator(expressionScheduler,
                properties.getExpression().getTimeout(),
                properties.getExpression().getCacheSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateRenderer templateRenderer(ExpressionEvaluator expressionEvaluator) {
        return new TemplateRenderer(expressionEvaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataBinder metadataBinder(ObjectMapper objectMapper, ObjectProvider<Validator> validatorProvider) {
        Validator validator = validatorProvider.getIfAvailable(() -> {
            log.info("上下文中没有 javax.validation.Validator，使用默认 ValidatorFactory。");
            return Validation.buildDefaultValidatorFactory().getValidator();
        });
        return new MetadataBinder(objectMapper, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeServiceSupport nodeServiceSupport(MetadataBinder metadataBinder,
                                                 ExpressionEvaluator expressionEvaluator,
                                                 TemplateRenderer templateRenderer) {
        return new NodeServiceSupport(metadataBinder, expressionEvaluator, templateRenderer);
    }

    // ---------------------------------------------------------------- 外部客户端

    @Bean
    @ConditionalOnMissingBean
    public CompletionClient completionClient() {
        log.info("未提供 CompletionClient，job 节点将在执行时失败。");
        return CompletionClient.notConfigured();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingClient embeddingClient() {
        return EmbeddingClient.notConfigured();
    }

    @Bean
    @ConditionalOnMissingBean
    public GuruClient guruClient() {
        return GuruClient.notConfigured();
    }

    @Bean
    @ConditionalOnMissingBean
    public VectorStoreClient vectorStoreClient() {
        return VectorStoreClient.notConfigured();
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpResourceClient httpResourceClient(ObjectProvider<WebClient.Builder> webClientBuilder, ObjectMapper objectMapper) {
        WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder).build();
        return new WebClientHttpResourceClient(webClient, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpAuthPresets httpAuthPresets(WorkflowFrameworkProperties properties) {
        log.info("加载了 {} 个 HTTP 认证预设: {}", properties.getHttp().getAuthPresets().size(),
                properties.getHttp().getAuthPresets().keySet());
        return new HttpAuthPresets(properties.getHttp().getAuthPresets());
    }

    // ---------------------------------------------------------------- 图、规划与执行

    @Bean
    @ConditionalOnMissingBean(NodeServiceRegistry.class)
    public SpringScanningNodeServiceRegistry nodeServiceRegistry() {
        return new SpringScanningNodeServiceRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public DagValidator dagValidator() {
        return new DagValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ShapePlanner shapePlanner(NodeServiceRegistry nodeServiceRegistry, DagValidator dagValidator) {
        return new ShapePlanner(nodeServiceRegistry, dagValidator);
    }

    @Bean
    @ConditionalOnMissingBean
    public AvailableDataResolver availableDataResolver(ShapePlanner shapePlanner) {
        return new AvailableDataResolver(shapePlanner);
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    public RunRegistry runRegistry(WorkflowFrameworkProperties properties,
                                   Clock clock,
                                   @Qualifier("workflowRunScheduler") Scheduler runScheduler) {
        WorkflowFrameworkProperties.Run run = properties.getRun();
        RunRegistry registry = new RunRegistry(run.getTtl(), run.getQueueCapacity(), clock);
        registry.startEviction(run.getEvictionInterval(), runScheduler);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public RunEventStream runEventStream(RunRegistry runRegistry,
                                         WorkflowFrameworkProperties properties,
                                         @Qualifier("workflowRunScheduler") Scheduler runScheduler) {
        return new RunEventStream(runRegistry, properties.getRun().getHeartbeatInterval(), runScheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingRunMonitorListener loggingRunMonitorListener() {
        return new LoggingRunMonitorListener();
    }

    /**
     * 收集上下文中所有的 RunMonitorListener Bean，作为不可变列表提供给执行器。
     */
    @Bean(name = "workflowMonitorListeners")
    @ConditionalOnMissingBean(name = "workflowMonitorListeners")
    public List<RunMonitorListener> workflowMonitorListeners(ObjectProvider<RunMonitorListener> listenersProvider) {
        List<RunMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 RunMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 RunMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeInvoker nodeInvoker(NodeServiceRegistry nodeServiceRegistry,
                                   MetadataBinder metadataBinder,
                                   WorkflowFrameworkProperties properties,
                                   @Qualifier("workflowNodeExecutionScheduler") Scheduler nodeExecutionScheduler,
                                   @Qualifier("workflowRetryBackoffSpec") RetryBackoffSpec retryBackoffSpec,
                                   @Qualifier("workflowMonitorListeners") List<RunMonitorListener> listeners) {
        return new StandardNodeInvoker(nodeServiceRegistry, metadataBinder,
                properties.getNode().getDefaultTimeout(), nodeExecutionScheduler, retryBackoffSpec, listeners);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRepository workflowRepository() {
        return new InMemoryWorkflowRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowExecutor workflowExecutor(DagValidator dagValidator,
                                             AvailableDataResolver availableDataResolver,
                                             NodeInvoker nodeInvoker,
                                             MetadataBinder metadataBinder,
                                             RunRegistry runRegistry,
                                             WorkflowRepository workflowRepository,
                                             @Qualifier("workflowRunScheduler") Scheduler runScheduler,
                                             Clock clock,
                                             WorkflowFrameworkProperties properties,
                                             @Qualifier("workflowMonitorListeners") List<RunMonitorListener> listeners) {
        log.info("正在创建 StandardWorkflowExecutor，配置: {}", properties);
        return new StandardWorkflowExecutor(dagValidator, availableDataResolver, nodeInvoker, metadataBinder,
                runRegistry, workflowRepository, runScheduler, clock,
                properties.getNode().getMaxSubWorkflowDepth(), listeners);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowOperations workflowOperations(WorkflowRepository workflowRepository,
                                                 NodeServiceRegistry nodeServiceRegistry,
                                                 DagValidator dagValidator,
                                                 ShapePlanner shapePlanner,
                                                 AvailableDataResolver availableDataResolver,
                                                 WorkflowExecutor workflowExecutor,
                                                 RunRegistry runRegistry,
                                                 RunEventStream runEventStream) {
        return new WorkflowOperations(workflowRepository, nodeServiceRegistry, dagValidator, shapePlanner,
                availableDataResolver, workflowExecutor, runRegistry, runEventStream);
    }

    private static Scheduler newBoundedElastic(WorkflowFrameworkProperties.SchedulerProps schedulerProps, String name) {
        WorkflowFrameworkProperties.BoundedElasticProps props = schedulerProps.getBoundedElastic();
        return Schedulers.newBoundedElastic(props.getThreadCap(), props.getQueuedTaskCap(), name, props.getTtlSeconds(), true);
    }

    /**
     * 固定线程数的调度器。节点实现会阻塞（表达式求值、HTTP 调用），
     * Reactor 自带的 parallel/single 线程禁止 block()，因此基于普通线程池创建。
     */
    static Scheduler newBlockingFixedScheduler(String namePrefix, int threads) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(namePrefix + "-");
        threadFactory.setDaemon(true);
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        return Schedulers.fromExecutorService(executor, namePrefix);
    }

    /**
     * 上下文中有 MeterRegistry 时注册 Micrometer 监听器。
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerListenerConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public MicrometerRunMonitorListener micrometerRunMonitorListener(MeterRegistry meterRegistry) {
            return new MicrometerRunMonitorListener(meterRegistry);
        }
    }
}
