package xyz.vvrf.reactor.workflow.test.util;

import xyz.vvrf.reactor.workflow.core.NodeInput;
import xyz.vvrf.reactor.workflow.core.NodeService;
import xyz.vvrf.reactor.workflow.core.NodeType;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * 用于测试目的的可配置 NodeService 实现。
 * 使用 Builder 模式进行配置，并记录被调用的次数。
 */
public class TestNodeService implements NodeService {

    private final NodeType nodeType;
    private final BiFunction<NodeInput, Map<String, Object>, Map<String, Object>> executionLogic;
    private final Map<String, Object> plannedOutput;
    private final Duration executionTimeout;
    private final AtomicInteger invocations = new AtomicInteger();

    private TestNodeService(Builder builder) {
        this.nodeType = Objects.requireNonNull(builder.nodeType, "节点类型不能为空");
        this.executionLogic = builder.executionLogic;
        this.plannedOutput = Collections.unmodifiableMap(new LinkedHashMap<>(builder.plannedOutput));
        this.executionTimeout = builder.executionTimeout;
    }

    @Override
    public NodeType nodeType() {
        return nodeType;
    }

    @Override
    public void validate(Map<String, Object> metadata, Map<String, Object> structuredOutput) {
    }

    @Override
    public Map<String, Object> plan(Map<String, Object> metadata,
                                    Map<String, Object> inputShape,
                                    Map<String, Object> structuredOutput) {
        return new LinkedHashMap<>(plannedOutput);
    }

    @Override
    public Map<String, Object> execute(NodeInput input, Map<String, Object> metadata) {
        invocations.incrementAndGet();
        return executionLogic.apply(input, metadata);
    }

    @Override
    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public int getInvocations() {
        return invocations.get();
    }

    public static Builder builder(NodeType nodeType) {
        return new Builder(nodeType);
    }

    public static class Builder {
        private final NodeType nodeType;
        private BiFunction<NodeInput, Map<String, Object>, Map<String, Object>> executionLogic =
                (input, metadata) -> new LinkedHashMap<>(input.getData());
        private Map<String, Object> plannedOutput = new LinkedHashMap<>();
        private Duration executionTimeout = null;

        Builder(NodeType nodeType) {
            this.nodeType = nodeType;
        }

        /**
         * 设置节点的执行逻辑。默认原样透传合并后的输入。
         */
        public Builder executionLogic(BiFunction<NodeInput, Map<String, Object>, Map<String, Object>> executionLogic) {
            this.executionLogic = Objects.requireNonNull(executionLogic);
            return this;
        }

        /**
         * 每次执行都返回给定输出的副本。
         */
        public Builder returnsOutput(Map<String, Object> output) {
            this.executionLogic = (input, metadata) -> new LinkedHashMap<>(output);
            return this;
        }

        /**
         * 每次执行都抛出给定异常。
         */
        public Builder failsWith(RuntimeException error) {
            this.executionLogic = (input, metadata) -> {
                throw error;
            };
            return this;
        }

        /**
         * 前 failures 次执行抛出异常，之后返回给定输出。
         */
        public Builder failsTimesThenReturns(int failures, RuntimeException error, Map<String, Object> output) {
            AtomicInteger attempts = new AtomicInteger();
            this.executionLogic = (input, metadata) -> {
                if (attempts.incrementAndGet() <= failures) {
                    throw error;
                }
                return new LinkedHashMap<>(output);
            };
            return this;
        }

        /**
         * 执行时阻塞给定时长后再返回输出，用于触发超时。
         */
        public Builder sleepsThenReturns(Duration sleep, Map<String, Object> output) {
            this.executionLogic = (input, metadata) -> {
                try {
                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted while sleeping", e);
                }
                return new LinkedHashMap<>(output);
            };
            return this;
        }

        public Builder plannedOutput(Map<String, Object> plannedOutput) {
            this.plannedOutput = new LinkedHashMap<>(plannedOutput);
            return this;
        }

        public Builder executionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
            return this;
        }

        public TestNodeService build() {
            return new TestNodeService(this);
        }
    }
}
