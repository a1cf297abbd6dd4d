package com.example.jobsync.client;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request/Response DTOs for the external scheduler client
 */
public class ClientModels {
    private ClientModels() {
    }

    public static final String EXECUTOR_SHELL = "shell";
    public static final String OWNER_METADATA_KEY = "cron";
    public static final String OWNER_METADATA_VALUE = "auto";
    public static final String LABEL_TAG = "label";

    /**
     * A job as the scheduler's REST API represents it.
     * <p>
     * Only the fields this service manages are typed. Everything else the scheduler
     * returns (status, next run, counters, ...) is kept in {@code additionalProperties}
     * so that re-posting a fetched job preserves it.
     */
    @Getter
    @Setter
    @Builder
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class SchedulerJob {

        @JsonProperty("name")
        private String name;

        @JsonProperty("schedule")
        private String schedule;

        @JsonProperty("parent_job")
        private String parentJob;

        @JsonProperty("executor")
        private String executor;

        @JsonProperty("tags")
        private Map<String, String> tags;

        @JsonProperty("metadata")
        private Map<String, String> metadata;

        @JsonProperty("disabled")
        private Boolean disabled;

        @JsonProperty("executor_config")
        private Map<String, String> executorConfig;

        @JsonProperty("retries")
        private Integer retries;

        @Setter(AccessLevel.NONE)
        @Builder.Default
        private Map<String, Object> additionalProperties = new LinkedHashMap<>();

        @JsonAnyGetter
        public Map<String, Object> getAdditionalProperties() {
            return additionalProperties;
        }

        @JsonAnySetter
        public void setAdditionalProperty(String key, Object value) {
            additionalProperties.put(key, value);
        }

        /**
         * Agent label this job is routed to, or null when untagged
         */
        @JsonIgnore
        public String getLabel() {
            return tags == null ? null : tags.get(LABEL_TAG);
        }

        @JsonIgnore
        public boolean isOwned() {
            return metadata != null && OWNER_METADATA_VALUE.equals(metadata.get(OWNER_METADATA_KEY));
        }

        /**
         * Independent copy; mutating it leaves this instance untouched
         */
        public SchedulerJob copy() {
            return SchedulerJob.builder()
                    .name(name)
                    .schedule(schedule)
                    .parentJob(parentJob)
                    .executor(executor)
                    .tags(tags == null ? null : new LinkedHashMap<>(tags))
                    .metadata(metadata == null ? null : new LinkedHashMap<>(metadata))
                    .disabled(disabled)
                    .executorConfig(executorConfig == null ? null : new LinkedHashMap<>(executorConfig))
                    .retries(retries)
                    .additionalProperties(new LinkedHashMap<>(additionalProperties))
                    .build();
        }
    }
}
