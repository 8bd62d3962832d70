package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 单个节点一次执行的结果（不可变数据类）。
 * 包含执行状态、输出对象以及失败时的错误信息。
 */
public final class NodeResult {

    /**
     * 节点执行状态枚举。
     */
    public enum NodeStatus {
        /** 节点成功执行，输出可能为空对象。*/
        SUCCESS,
        /** 节点执行失败，必须包含错误信息。*/
        FAILURE,
        /** 节点被跳过（分支未命中或上游失败）。*/
        SKIPPED
    }

    @Getter private final NodeStatus status;
    @Getter private final Map<String, Object> output;
    private final Throwable error;

    /**
     * 私有构造函数，请使用静态工厂方法创建实例。
     */
    private NodeResult(NodeStatus status, Map<String, Object> output, Throwable error) {
        this.status = Objects.requireNonNull(status, "节点状态不能为空");
        this.output = output == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(output));
        this.error = error;

        if (status == NodeStatus.FAILURE && error == null) {
            throw new IllegalArgumentException("FAILURE 状态的结果必须包含一个非空的错误信息。");
        }
        if (status != NodeStatus.FAILURE && error != null) {
            throw new IllegalArgumentException("非 FAILURE 状态的结果不能包含错误信息。");
        }
    }

    // --- 静态工厂方法 ---

    public static NodeResult success(Map<String, Object> output) {
        return new NodeResult(NodeStatus.SUCCESS, output, null);
    }

    public static NodeResult failure(Throwable error) {
        Objects.requireNonNull(error, "错误对象不能为空");
        return new NodeResult(NodeStatus.FAILURE, null, error);
    }

    public static NodeResult skipped() {
        return new NodeResult(NodeStatus.SKIPPED, null, null);
    }

    // --- 实例方法 ---

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return status == NodeStatus.SUCCESS;
    }

    public boolean isFailure() {
        return status == NodeStatus.FAILURE;
    }

    public boolean isSkipped() {
        return status == NodeStatus.SKIPPED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeResult that = (NodeResult) o;
        return status == that.status &&
                output.equals(that.output) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, output, error);
    }

    @Override
    public String toString() {
        return "NodeResult{" +
                "status=" + status +
                ", outputKeys=" + output.keySet() +
                (error != null ? ", error=" + error.getClass().getSimpleName() + ": " + error.getMessage() : "") +
                '}';
    }
}
