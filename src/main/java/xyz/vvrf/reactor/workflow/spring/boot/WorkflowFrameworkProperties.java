package xyz.vvrf.reactor.workflow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 工作流框架的配置属性，绑定 'workflow' 前缀下的属性。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "workflow")
@Validated
public class WorkflowFrameworkProperties {

    @Valid
    private final Run run = new Run();
    @Valid
    private final Expression expression = new Expression();
    @Valid
    private final Node node = new Node();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final RetryProps retry = new RetryProps();
    @Valid
    private final Http http = new Http();

    @Getter
    @Setter
    public static class Run {
        /**
         * 运行状态的存活时间，从 finished_at 起算（未结束的运行从 started_at 起算）。
         */
        @NotNull
        private Duration ttl = Duration.ofSeconds(900);

        /**
         * 后台驱逐任务的执行间隔。
         */
        @NotNull
        private Duration evictionInterval = Duration.ofSeconds(60);

        /**
         * 每个运行的事件通道容量。
         */
        @Min(1)
        private int queueCapacity = 1000;

        /**
         * 事件流的心跳间隔，同时是每次等待新事件的超时时间。
         */
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class Expression {
        /**
         * 单次表达式求值的超时时间。
         */
        @NotNull
        private Duration timeout = Duration.ofMillis(100);

        /**
         * 已解析表达式的缓存条目上限。
         */
        @Min(1)
        private long cacheSize = 1000;
    }

    @Getter
    @Setter
    public static class Node {
        /**
         * 节点未配置 timeout_ms 时的执行超时。
         */
        @NotNull
        private Duration defaultTimeout = Duration.ofSeconds(30);

        /**
         * workflow 节点的最大嵌套深度。
         */
        @Min(1)
        private int maxSubWorkflowDepth = 8;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 节点执行调度器类型。
         */
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器名称前缀。
         */
        private String namePrefix = "workflow-exec";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    /**
     * 节点设置了 retry 时使用的退避策略；尝试次数由节点自己的 retry 字段决定。
     */
    @Getter
    @Setter
    public static class RetryProps {
        /**
         * 首次/固定退避延迟时间。
         */
        private Duration firstBackoff = Duration.ofMillis(100);

        /**
         * 是否使用指数退避。如果为 false，则使用 firstBackoff 作为固定延迟。
         */
        private boolean useExponentialBackoff = false;

        /**
         * (仅用于指数退避) 最大退避延迟时间。
         */
        private Duration maxBackoff = Duration.ofSeconds(10);

        /**
         * (仅用于指数退避) 抖动因子 (0.0 到 1.0)。
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double jitterFactor = 0.5;
    }

    @Getter
    @Setter
    public static class Http {
        /**
         * 命名的认证请求头预设，例如 workflow.http.auth-presets.internal.Authorization=Bearer xxx。
         */
        private Map<String, Map<String, String>> authPresets = new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "WorkflowFrameworkProperties{" +
                "run={ttl=" + run.ttl +
                ", evictionInterval=" + run.evictionInterval +
                ", queueCapacity=" + run.queueCapacity +
                ", heartbeatInterval=" + run.heartbeatInterval +
                "}, expression={timeout=" + expression.timeout +
                ", cacheSize=" + expression.cacheSize +
                "}, node={defaultTimeout=" + node.defaultTimeout +
                ", maxSubWorkflowDepth=" + node.maxSubWorkflowDepth +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                "}, retry={firstBackoff=" + retry.firstBackoff +
                ", useExponentialBackoff=" + retry.useExponentialBackoff +
                "}, authPresets=" + http.authPresets.keySet() +
                '}';
    }
}
