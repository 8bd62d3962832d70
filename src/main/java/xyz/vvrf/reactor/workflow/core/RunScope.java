package xyz.vvrf.reactor.workflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一次运行内对节点可见的作用域：运行 id、当前工作流、子工作流嵌套深度、
 * base 环境值以及执行子工作流的入口。
 */
public final class RunScope {

    private final String runId;
    private final long workflowId;
    private final int depth;
    private final Map<String, Object> base;
    private final SubWorkflowRunner subWorkflowRunner;

    public RunScope(String runId, long workflowId, int depth,
                    Map<String, Object> base, SubWorkflowRunner subWorkflowRunner) {
        this.runId = Objects.requireNonNull(runId, "运行 ID 不能为空");
        this.workflowId = workflowId;
        this.depth = depth;
        this.base = base == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(base));
        this.subWorkflowRunner = subWorkflowRunner;
    }

    /**
     * 不属于任何运行的作用域，用于单独测试节点或预览。
     */
    public static RunScope detached(Map<String, Object> base) {
        return new RunScope("detached", 0L, 0, base, null);
    }

    public String getRunId() {
        return runId;
    }

    public long getWorkflowId() {
        return workflowId;
    }

    public int getDepth() {
        return depth;
    }

    public Map<String, Object> getBase() {
        return base;
    }

    public SubWorkflowRunner getSubWorkflowRunner() {
        if (subWorkflowRunner == null) {
            throw new IllegalStateException("当前作用域不支持执行子工作流 (runId: " + runId + ")");
        }
        return subWorkflowRunner;
    }

    /**
     * 进入子工作流时派生的作用域，深度加一。
     */
    public RunScope child(long childWorkflowId) {
        return new RunScope(runId, childWorkflowId, depth + 1, base, subWorkflowRunner);
    }

    public RunScope withoutBaseKey(String key) {
        if (!base.containsKey(key)) {
            return this;
        }
        Map<String, Object> reduced = new LinkedHashMap<>(base);
        reduced.remove(key);
        return new RunScope(runId, workflowId, depth, reduced, subWorkflowRunner);
    }

    @Override
    public String toString() {
        return "RunScope{runId='" + runId + "', workflowId=" + workflowId + ", depth=" + depth + '}';
    }
}
