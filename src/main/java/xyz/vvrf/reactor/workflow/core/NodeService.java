package xyz.vvrf.reactor.workflow.core;

import java.time.Duration;
import java.util.Map;

/**
 * 单个节点类型的行为：配置校验、形状规划和真实执行。
 * 每个 {@link NodeType} 恰好对应一个实现，由 {@code NodeServiceRegistry} 按类型分发。
 * <p>
 * 实现应该是无状态且线程安全的，同一个实例会被并发的多个运行共享。
 */
public interface NodeService {

    /**
     * 该实现负责的节点类型。
     */
    NodeType nodeType();

    /**
     * 校验节点配置。
     *
     * @param metadata         节点 metadata
     * @param structuredOutput 声明的输出形状，可为空
     * @throws xyz.vvrf.reactor.workflow.exception.NodeValidationException 必填字段缺失、格式错误、未知 key 或表达式语法错误
     */
    void validate(Map<String, Object> metadata, Map<String, Object> structuredOutput);

    /**
     * 在不执行的前提下给出指示性的输出形状。
     *
     * @param metadata         节点 metadata
     * @param inputShape       合并后的输入形状
     * @param structuredOutput 声明的输出形状，可为空
     * @return 输出形状
     */
    Map<String, Object> plan(Map<String, Object> metadata,
                             Map<String, Object> inputShape,
                             Map<String, Object> structuredOutput);

    /**
     * 真实执行节点。可以阻塞（调用方负责调度与超时）。
     *
     * @param input    合并后的真实输入
     * @param metadata 节点 metadata
     * @return 节点输出对象
     * @throws xyz.vvrf.reactor.workflow.exception.WorkflowException 执行失败
     */
    Map<String, Object> execute(NodeInput input, Map<String, Object> metadata);

    /**
     * 节点类型级别的默认执行超时，返回 null 表示使用全局默认值。
     */
    default Duration getExecutionTimeout() {
        return null;
    }
}
