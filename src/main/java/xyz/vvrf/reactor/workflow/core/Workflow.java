package xyz.vvrf.reactor.workflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 工作流本身（只保留触发器相关信息）。
 * 没有 cron 计划且未开放 API 调用时，校验器给出 "no trigger configured" 警告。
 */
public final class Workflow {

    private final long id;
    private final String name;
    private final String cronSchedule;
    private final boolean api;

    @JsonCreator
    public Workflow(@JsonProperty("id") long id,
                    @JsonProperty("name") String name,
                    @JsonProperty("cron_schedule") String cronSchedule,
                    @JsonProperty("is_api") boolean api) {
        this.id = id;
        this.name = name;
        this.cronSchedule = cronSchedule;
        this.api = api;
    }

    @JsonProperty("id")
    public long getId() {
        return id;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("cron_schedule")
    public String getCronSchedule() {
        return cronSchedule;
    }

    @JsonProperty("is_api")
    public boolean isApi() {
        return api;
    }

    public boolean hasCronSchedule() {
        return cronSchedule != null && !cronSchedule.trim().isEmpty();
    }

    /**
     * 是否至少配置了一种外部触发方式。
     */
    public boolean hasTrigger() {
        return api || hasCronSchedule();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Workflow workflow = (Workflow) o;
        return id == workflow.id &&
                api == workflow.api &&
                Objects.equals(name, workflow.name) &&
                Objects.equals(cronSchedule, workflow.cronSchedule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, cronSchedule, api);
    }

    @Override
    public String toString() {
        return "Workflow{id=" + id + ", name='" + name + "', cronSchedule='" + cronSchedule + "', api=" + api + '}';
    }
}
