package xyz.vvrf.reactor.workflow.core;

import java.util.Map;

/**
 * 在当前运行内执行一个子工作流的能力，由执行器提供给 workflow 类型的节点。
 */
@FunctionalInterface
public interface SubWorkflowRunner {

    /**
     * 校验并同步执行指定的子工作流。
     *
     * @param workflowId 子工作流 ID
     * @param inputs     子工作流的起始输入
     * @param scope      调用方所在的作用域
     * @return 子工作流的 return 节点 payload；没有 return 节点时为所有汇点输出的合并结果
     */
    Map<String, Object> run(long workflowId, Map<String, Object> inputs, RunScope scope);
}
