package xyz.vvrf.reactor.workflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * DAG 结构校验结果（不可变数据类）。
 * topoOrder 只有在 errors 为空时才有意义，存在环时为空列表。
 */
public final class DagValidationResult {

    private final List<String> errors;
    private final List<String> warnings;
    private final List<Long> topoOrder;

    @JsonCreator
    public DagValidationResult(@JsonProperty("errors") List<String> errors,
                               @JsonProperty("warnings") List<String> warnings,
                               @JsonProperty("topo_order") List<Long> topoOrder) {
        this.errors = copy(errors);
        this.warnings = copy(warnings);
        this.topoOrder = copy(topoOrder);
    }

    private static <T> List<T> copy(List<T> source) {
        return source == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(source));
    }

    @JsonProperty("errors")
    public List<String> getErrors() {
        return errors;
    }

    @JsonProperty("warnings")
    public List<String> getWarnings() {
        return warnings;
    }

    @JsonProperty("topo_order")
    public List<Long> getTopoOrder() {
        return topoOrder;
    }

    @JsonIgnore
    public boolean isValid() {
        return errors.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DagValidationResult that = (DagValidationResult) o;
        return errors.equals(that.errors) &&
                warnings.equals(that.warnings) &&
                topoOrder.equals(that.topoOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errors, warnings, topoOrder);
    }

    @Override
    public String toString() {
        return "DagValidationResult{" +
                "errors=" + errors +
                ", warnings=" + warnings +
                ", topoOrder=" + topoOrder +
                '}';
    }
}
