package xyz.vvrf.reactor.workflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * 形状规划中单个节点的投影：输入形状、输出形状以及合并冲突等说明。
 */
public final class PlannedNode {

    private final long nodeId;
    private final NodeType nodeType;
    private final Map<String, Object> inputShape;
    private final Map<String, Object> outputShape;
    private final List<String> notes;

    @JsonCreator
    public PlannedNode(@JsonProperty("node_id") long nodeId,
                       @JsonProperty("node_type") NodeType nodeType,
                       @JsonProperty("input_shape") Map<String, Object> inputShape,
                       @JsonProperty("output_shape") Map<String, Object> outputShape,
                       @JsonProperty("notes") List<String> notes) {
        this.nodeId = nodeId;
        this.nodeType = Objects.requireNonNull(nodeType, "节点类型不能为空");
        this.inputShape = inputShape == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputShape));
        this.outputShape = outputShape == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(outputShape));
        this.notes = notes == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(notes));
    }

    @JsonProperty("node_id")
    public long getNodeId() {
        return nodeId;
    }

    @JsonProperty("node_type")
    public NodeType getNodeType() {
        return nodeType;
    }

    @JsonProperty("input_shape")
    public Map<String, Object> getInputShape() {
        return inputShape;
    }

    @JsonProperty("output_shape")
    public Map<String, Object> getOutputShape() {
        return outputShape;
    }

    @JsonProperty("notes")
    public List<String> getNotes() {
        return notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlannedNode that = (PlannedNode) o;
        return nodeId == that.nodeId &&
                nodeType == that.nodeType &&
                inputShape.equals(that.inputShape) &&
                outputShape.equals(that.outputShape) &&
                notes.equals(that.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, nodeType, inputShape, outputShape, notes);
    }

    @Override
    public String toString() {
        return "PlannedNode{" +
                "nodeId=" + nodeId +
                ", nodeType=" + nodeType +
                ", inputShape=" + inputShape +
                ", outputShape=" + outputShape +
                ", notes=" + notes +
                '}';
    }
}
