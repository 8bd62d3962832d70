package xyz.vvrf.reactor.workflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 工作流中的一条有向边（不可变数据类）。
 * branchLabel 仅对 if_else 父节点有意义（"true"/"false"），其余情况为 null。
 * 自环和重复边不会在这里拒绝，由仓库和校验器分别报告。
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class WorkflowEdge {

    public static final String LABEL_TRUE = "true";
    public static final String LABEL_FALSE = "false";

    private final long id;
    private final long parentId;
    private final long childId;
    private final String branchLabel;

    @JsonCreator
    public WorkflowEdge(@JsonProperty("id") long id,
                        @JsonProperty("parent_id") long parentId,
                        @JsonProperty("child_id") long childId,
                        @JsonProperty("branch_label") String branchLabel) {
        this.id = id;
        this.parentId = parentId;
        this.childId = childId;
        this.branchLabel = branchLabel;
    }

    public static WorkflowEdge of(long id, long parentId, long childId) {
        return new WorkflowEdge(id, parentId, childId, null);
    }

    public static WorkflowEdge labeled(long id, long parentId, long childId, String branchLabel) {
        return new WorkflowEdge(id, parentId, childId, branchLabel);
    }

    @JsonProperty("id")
    public long getId() {
        return id;
    }

    @JsonProperty("parent_id")
    public long getParentId() {
        return parentId;
    }

    @JsonProperty("child_id")
    public long getChildId() {
        return childId;
    }

    @JsonProperty("branch_label")
    public String getBranchLabel() {
        return branchLabel;
    }

    public boolean hasBranchLabel() {
        return branchLabel != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowEdge that = (WorkflowEdge) o;
        return id == that.id &&
                parentId == that.parentId &&
                childId == that.childId &&
                Objects.equals(branchLabel, that.branchLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parentId, childId, branchLabel);
    }

    @Override
    public String toString() {
        return "WorkflowEdge{" +
                "id=" + id +
                ", " + parentId + " -> " + childId +
                (branchLabel != null ? ", branchLabel='" + branchLabel + '\'' : "") +
                '}';
    }
}
