package xyz.vvrf.reactor.workflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 工作流中的一个节点（不可变数据类）。
 * metadata 是类型相关的配置对象，只有对应类型的 {@link NodeService} 理解其内容；
 * structuredOutput 是声明的输出形状（嵌套的 key/type 描述，可为空）。
 */
public final class WorkflowNode {

    private final long id;
    private final long workflowId;
    private final NodeType nodeType;
    private final Map<String, Object> metadata;
    private final Map<String, Object> structuredOutput;

    @JsonCreator
    public WorkflowNode(@JsonProperty("id") long id,
                        @JsonProperty("workflow_id") long workflowId,
                        @JsonProperty("node_type") NodeType nodeType,
                        @JsonProperty("metadata") Map<String, Object> metadata,
                        @JsonProperty("structured_output") Map<String, Object> structuredOutput) {
        this.id = id;
        this.workflowId = workflowId;
        this.nodeType = Objects.requireNonNull(nodeType, "节点类型不能为空");
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.structuredOutput = structuredOutput == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(structuredOutput));
    }

    public static WorkflowNode of(long id, NodeType nodeType, Map<String, Object> metadata) {
        return new WorkflowNode(id, 0L, nodeType, metadata, null);
    }

    @JsonProperty("id")
    public long getId() {
        return id;
    }

    @JsonProperty("workflow_id")
    public long getWorkflowId() {
        return workflowId;
    }

    @JsonProperty("node_type")
    public NodeType getNodeType() {
        return nodeType;
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonProperty("structured_output")
    public Map<String, Object> getStructuredOutput() {
        return structuredOutput;
    }

    public WorkflowNode withWorkflowId(long newWorkflowId) {
        return new WorkflowNode(id, newWorkflowId, nodeType, metadata, structuredOutput);
    }

    public WorkflowNode withStructuredOutput(Map<String, Object> newStructuredOutput) {
        return new WorkflowNode(id, workflowId, nodeType, metadata, newStructuredOutput);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return id == that.id &&
                workflowId == that.workflowId &&
                nodeType == that.nodeType &&
                metadata.equals(that.metadata) &&
                structuredOutput.equals(that.structuredOutput);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, workflowId, nodeType, metadata, structuredOutput);
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
                "id=" + id +
                ", workflowId=" + workflowId +
                ", nodeType=" + nodeType +
                ", metadataKeys=" + metadata.keySet() +
                '}';
    }
}
