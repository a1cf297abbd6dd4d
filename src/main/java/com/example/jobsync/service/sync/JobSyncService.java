package com.example.jobsync.service.sync;

import com.example.jobsync.client.ClientModels;
import com.example.jobsync.client.ClientModels.SchedulerJob;
import com.example.jobsync.client.SchedulerClient;
import com.example.jobsync.config.MetricsConfig;
import com.example.jobsync.config.SchedulerProperties;
import com.example.jobsync.domain.entity.Job;
import com.example.jobsync.domain.enums.SyncAction;
import com.example.jobsync.domain.repository.JobRepository;
import com.example.jobsync.exception.SchedulerException;
import com.example.jobsync.service.namespace.NamespaceCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Mirrors local job definitions into the external scheduler.
 * <p>
 * Single-job operations ({@link #syncJob}, {@link #deleteJob}) propagate scheduler
 * failures to the caller. {@link #resyncAll} is a full reconciliation: it pushes every
 * local job in dependency order and deletes remote jobs this deployment owns but no
 * longer has, reporting per-job failures without aborting.
 * <p>
 * At most one reconciliation pass should run at a time; that is left to the caller
 * (see {@link ScheduledResyncService}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSyncService {

    static final String MANUAL_SCHEDULE = "@manually";

    private final SchedulerClient schedulerClient;
    private final JobRepository jobRepository;
    private final NamespaceCodec namespaceCodec;
    private final JobDependencyGrapher dependencyGrapher;
    private final SchedulerProperties schedulerProperties;
    private final MetricsConfig metricsConfig;

    // === Single job ===

    /**
     * Push a job, replacing whatever the scheduler holds under its name
     */
    public void syncJob(Job job) {
        syncJob(job, MergeMode.replace());
    }

    /**
     * Push a job to the scheduler.
     *
     * @throws SchedulerException when the push fails, unmodified
     */
    public void syncJob(Job job, MergeMode mode) {
        var wireName = namespaceCodec.addNamespace(job.getName());
        var base = switch (mode.getKind()) {
            case REPLACE -> new SchedulerJob();
            case FETCH_AND_MERGE -> fetchOrEmpty(job, wireName);
            case MERGE_WITH -> mode.getSnapshot().copy();
        };

        var spec = buildSchedulerJob(job, base);
        log.debug("Syncing job {} as {} ({})", job.getName(), wireName, mode.getKind());
        schedulerClient.createOrUpdate(spec);
    }

    /**
     * Apply the fields this service manages onto {@code base}.
     * <p>
     * A {@code @parent X} schedule becomes {@code @manually} plus an explicit
     * {@code parent_job}, since the scheduler has no notion of the shorthand.
     */
    public SchedulerJob buildSchedulerJob(Job job, SchedulerJob base) {
        var parentJob = namespaceCodec.addNamespace(job.getParentName());
        var hasParent = !parentJob.isEmpty();

        Map<String, String> tags = new LinkedHashMap<>();
        if (schedulerProperties.hasJobLabel()) {
            tags.put(ClientModels.LABEL_TAG, schedulerProperties.getJobLabel() + ":1");
        }

        Map<String, String> executorConfig = new LinkedHashMap<>();
        executorConfig.put("shell", job.isUseShell() ? "true" : "false");
        executorConfig.put("command", job.getCommand());

        base.setName(namespaceCodec.addNamespace(job.getName()));
        base.setSchedule(hasParent ? MANUAL_SCHEDULE : job.getSchedule());
        base.setParentJob(hasParent ? parentJob : null);
        base.setExecutor(ClientModels.EXECUTOR_SHELL);
        base.setTags(tags);
        base.setMetadata(new LinkedHashMap<>(Map.of(ClientModels.OWNER_METADATA_KEY, ClientModels.OWNER_METADATA_VALUE)));
        base.setDisabled(!job.isEnabled());
        base.setExecutorConfig(executorConfig);
        base.setRetries(job.getRetries());
        return base;
    }

    public void deleteJob(Job job) {
        deleteJob(job.getName());
    }

    /**
     * Delete a job from the scheduler by its local name
     *
     * @throws SchedulerException when the delete fails, unmodified
     */
    public void deleteJob(String jobName) {
        schedulerClient.deleteJob(namespaceCodec.addNamespace(jobName));
    }

    private SchedulerJob fetchOrEmpty(Job job, String wireName) {
        try {
            return schedulerClient.getJob(wireName).orElseGet(SchedulerJob::new);
        } catch (SchedulerException e) {
            log.warn("Fetching job {} ({}) failed, pushing it as a replacement: {}", job.getName(), wireName, e.getMessage());
            return new SchedulerJob();
        }
    }

    // === Reconciliation ===

    /**
     * Run a reconciliation pass and collect every result
     */
    public List<SyncResult> resyncAll() {
        var results = new ArrayList<SyncResult>();
        resyncAll(results::add);
        return results;
    }

    /**
     * Run a reconciliation pass, handing each job's outcome to {@code listener} as soon
     * as it is known.
     *
     * @throws SchedulerException if the remote job list cannot be fetched; nothing has
     *                            been changed in that case
     */
    public void resyncAll(Consumer<SyncResult> listener) {
        var previous = ownedRemoteJobs();
        var order = dependencyGrapher.order(jobRepository.findAll());

        var updated = new AtomicInteger();
        var deleted = new AtomicInteger();
        var failed = new AtomicInteger();
        Consumer<SyncResult> emit = result -> {
            if (!result.isSuccess()) {
                failed.incrementAndGet();
            } else if (result.getAction() == SyncAction.UPDATE) {
                updated.incrementAndGet();
            } else {
                deleted.incrementAndGet();
            }
            metricsConfig.recordSyncResult(result);
            listener.accept(result);
        };

        var current = new HashSet<String>();

        for (var job : order.getOrdered()) {
            current.add(job.getName());
            var snapshot = previous.get(job.getName());
            try {
                syncJob(job, snapshot != null ? MergeMode.mergeWith(snapshot) : MergeMode.replace());
                emit.accept(SyncResult.updated(job.getName()));
            } catch (SchedulerException e) {
                log.warn("Failed to sync job {}: {}", job.getName(), e.getMessage());
                emit.accept(SyncResult.updateFailed(job.getName(), e.getMessage()));
            }
        }

        // unresolved jobs still exist locally, so their remote copies must not be treated as orphans
        for (var entry : order.getUnresolved().entrySet()) {
            for (var job : entry.getValue()) {
                current.add(job.getName());
                emit.accept(SyncResult.updateFailed(job.getName(), String.format(
                        "Not synced: parent job '%s' does not exist or is part of a dependency cycle", entry.getKey())));
            }
        }

        for (var orphan : previous.keySet()) {
            if (current.contains(orphan)) {
                continue;
            }
            try {
                deleteJob(orphan);
                emit.accept(SyncResult.deleted(orphan));
            } catch (SchedulerException e) {
                log.warn("Failed to delete orphaned job {}: {}", orphan, e.getMessage());
                emit.accept(SyncResult.deleteFailed(orphan, e.getMessage()));
            }
        }

        log.info("Reconciliation finished: {} updated, {} deleted, {} failed", updated.get(), deleted.get(), failed.get());
    }

    /**
     * Remote jobs carrying the ownership marker that belong to this namespace and label,
     * keyed by local name
     */
    private Map<String, SchedulerJob> ownedRemoteJobs() {
        Map<String, SchedulerJob> owned = new LinkedHashMap<>();
        for (var remote : schedulerClient.listOwnedJobs()) {
            var name = namespaceCodec.trimNamespace(remote.getName());
            if (name.isEmpty()) {
                continue;
            }
            if (schedulerProperties.hasJobLabel() && !labelMatches(remote.getLabel())) {
                log.warn("Job {} ({}) matches metadata but it is missing the label - maybe namespacing required?",
                        name, remote.getName());
                continue;
            }
            owned.put(name, remote);
        }
        return owned;
    }

    /**
     * The label is pushed as {@code "<label>:1"} (agent cardinality); either form matches
     */
    private boolean labelMatches(String remoteLabel) {
        if (remoteLabel == null) {
            return false;
        }
        var label = remoteLabel.replaceFirst(":\\d+$", "");
        return label.equals(schedulerProperties.getJobLabel());
    }
}
