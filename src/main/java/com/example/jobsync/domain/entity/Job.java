package com.example.jobsync.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A job definition owned by this service and mirrored into the external scheduler.
 * <p>
 * The schedule is either a cron expression, a named preset ({@code @daily},
 * {@code @every 5m}, {@code @manually}, ...) or {@code @parent <name>}, which makes
 * the job run after the named job.
 * <p>
 * {@code lastRunDate} and {@code lastRunSuccess} are written only by the execution
 * webhook.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_enabled", columnList = "enabled")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

    public static final String PARENT_PREFIX = "@parent ";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Unique, lowercase, [a-z0-9_-]+
     */
    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Column(name = "schedule", nullable = false)
    private String schedule;

    /**
     * Passed through verbatim to the scheduler's shell executor
     */
    @Column(name = "command", nullable = false)
    private String command;

    @Column(name = "description")
    private String description;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    /**
     * Run the command through /bin/sh -c
     */
    @Column(name = "use_shell", nullable = false)
    @Builder.Default
    private boolean useShell = false;

    @Column(name = "last_run_date")
    private Instant lastRunDate;

    @Column(name = "last_run_success")
    private Boolean lastRunSuccess;

    @Column(name = "notify_on_error", nullable = false)
    @Builder.Default
    private boolean notifyOnError = true;

    @Column(name = "retries", nullable = false)
    @Builder.Default
    private int retries = 0;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Name of the job this one depends on, or an empty string when the schedule
     * is not a {@code @parent} reference.
     */
    public String getParentName() {
        if (schedule == null || !schedule.startsWith(PARENT_PREFIX)) {
            return "";
        }
        return schedule.substring(PARENT_PREFIX.length());
    }

    public boolean hasParent() {
        return !getParentName().isEmpty();
    }

    @Override
    public String toString() {
        return name;
    }
}
