package com.example.jobsync.service.sync;

import com.example.jobsync.client.ClientModels.SchedulerJob;
import com.example.jobsync.client.SchedulerClient;
import com.example.jobsync.config.MetricsConfig;
import com.example.jobsync.config.SchedulerProperties;
import com.example.jobsync.domain.entity.Job;
import com.example.jobsync.domain.enums.SyncAction;
import com.example.jobsync.domain.repository.JobRepository;
import com.example.jobsync.exception.SchedulerRejectedException;
import com.example.jobsync.exception.SchedulerUnreachableException;
import com.example.jobsync.service.namespace.NamespaceCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobSyncService Tests")
class JobSyncServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private SchedulerClient schedulerClient;

    @Mock
    private JobRepository jobRepository;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<SchedulerJob> jobCaptor;

    private SchedulerProperties properties;
    private JobSyncService jobSyncService;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        properties.setUrl("http://scheduler:8080");
        jobSyncService = newService(null);
    }

    private JobSyncService newService(String namespace) {
        properties.setNamespace(namespace);
        return new JobSyncService(schedulerClient, jobRepository, new NamespaceCodec(properties),
                new JobDependencyGrapher(), properties, metricsConfig);
    }

    private static Job job(String name, String schedule) {
        return Job.builder().name(name).schedule(schedule).command("echo " + name).build();
    }

    private static SchedulerJob remote(String wireName, String label) {
        var tags = new LinkedHashMap<String, String>();
        if (label != null) {
            tags.put("label", label);
        }
        var remote = SchedulerJob.builder()
                .name(wireName)
                .schedule("@daily")
                .tags(tags)
                .metadata(new LinkedHashMap<>(Map.of("cron", "auto")))
                .build();
        remote.setAdditionalProperty("success_count", 7);
        return remote;
    }

    @Nested
    @DisplayName("Building the wire job")
    class BuildSchedulerJobTests {

        @Test
        @DisplayName("Should produce the exact body for a plain job without namespace")
        void shouldBuildPlainJob() throws Exception {
            // Given
            var job = Job.builder().name("job1").schedule("").command("echo hi").enabled(true).build();

            // When
            jobSyncService.syncJob(job);

            // Then
            verify(schedulerClient).createOrUpdate(jobCaptor.capture());
            JsonNode expected = objectMapper.readTree("""
                    {"name": "job1", "schedule": "", "parent_job": null, "executor": "shell",
                     "tags": {}, "metadata": {"cron": "auto"}, "disabled": false,
                     "executor_config": {"shell": "false", "command": "echo hi"}, "retries": 0}
                    """);
            JsonNode actual = objectMapper.valueToTree(jobCaptor.getValue());
            assertThat(actual).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should turn @parent into @manually with a namespaced parent_job")
        void shouldMapParentSchedule() {
            var service = newService("team");
            var job = job("child", "@parent root");

            var spec = service.buildSchedulerJob(job, new SchedulerJob());

            assertThat(spec.getName()).isEqualTo("team_child");
            assertThat(spec.getSchedule()).isEqualTo("@manually");
            assertThat(spec.getParentJob()).isEqualTo("team_root");
        }

        @Test
        @DisplayName("Should tag the job with the configured label and flags")
        void shouldApplyLabelAndFlags() {
            properties.setJobLabel("workers");
            var job = Job.builder().name("job1").schedule("@hourly").command("ls -l | wc")
                    .useShell(true).enabled(false).retries(3).build();

            var spec = jobSyncService.buildSchedulerJob(job, new SchedulerJob());

            assertThat(spec.getTags()).containsExactly(Map.entry("label", "workers:1"));
            assertThat(spec.getDisabled()).isTrue();
            assertThat(spec.getRetries()).isEqualTo(3);
            assertThat(spec.getExecutorConfig()).containsEntry("shell", "true").containsEntry("command", "ls -l | wc");
        }

        @Test
        @DisplayName("Should push equivalent bodies when synced twice")
        void shouldBeIdempotent() {
            var job = job("job1", "@daily");

            jobSyncService.syncJob(job);
            jobSyncService.syncJob(job);

            verify(schedulerClient, times(2)).createOrUpdate(jobCaptor.capture());
            var bodies = jobCaptor.getAllValues();
            JsonNode first = objectMapper.valueToTree(bodies.get(0));
            JsonNode second = objectMapper.valueToTree(bodies.get(1));
            assertThat(first).isEqualTo(second);
        }
    }

    @Nested
    @DisplayName("Merge modes")
    class MergeModeTests {

        @Test
        @DisplayName("Should keep scheduler-side fields when merging with a snapshot")
        void shouldMergeWithSnapshot() {
            var snapshot = remote("job1", null);
            snapshot.setSchedule("@weekly");

            jobSyncService.syncJob(job("job1", "@daily"), MergeMode.mergeWith(snapshot));

            verify(schedulerClient).createOrUpdate(jobCaptor.capture());
            var pushed = jobCaptor.getValue();
            assertThat(pushed.getSchedule()).isEqualTo("@daily");
            assertThat(pushed.getAdditionalProperties()).containsEntry("success_count", 7);
            assertThat(snapshot.getSchedule()).isEqualTo("@weekly");
        }

        @Test
        @DisplayName("Should fetch the remote job before merging")
        void shouldFetchAndMerge() {
            when(schedulerClient.getJob("job1")).thenReturn(Optional.of(remote("job1", null)));

            jobSyncService.syncJob(job("job1", "@daily"), MergeMode.fetchAndMerge());

            verify(schedulerClient).createOrUpdate(jobCaptor.capture());
            assertThat(jobCaptor.getValue().getAdditionalProperties()).containsEntry("success_count", 7);
        }

        @Test
        @DisplayName("Should push as a replacement when the fetch fails")
        void shouldReplaceWhenFetchFails() {
            when(schedulerClient.getJob("job1")).thenThrow(new SchedulerUnreachableException("down"));

            jobSyncService.syncJob(job("job1", "@daily"), MergeMode.fetchAndMerge());

            verify(schedulerClient).createOrUpdate(jobCaptor.capture());
            assertThat(jobCaptor.getValue().getAdditionalProperties()).isEmpty();
        }

        @Test
        @DisplayName("Should propagate push failures for a single job")
        void shouldPropagatePushFailure() {
            doThrow(new SchedulerRejectedException(400, "bad schedule")).when(schedulerClient).createOrUpdate(any());

            assertThatThrownBy(() -> jobSyncService.syncJob(job("job1", "@daily")))
                    .isInstanceOf(SchedulerRejectedException.class)
                    .hasMessageContaining("bad schedule");
        }

        @Test
        @DisplayName("Should delete by namespaced name")
        void shouldDeleteNamespaced() {
            newService("team").deleteJob("job1");

            verify(schedulerClient).deleteJob("team_job1");
        }
    }

    @Nested
    @DisplayName("Reconciliation")
    class ResyncTests {

        @Test
        @DisplayName("Should update local jobs, delete owned orphans and skip other labels")
        void shouldReconcile() {
            // Given
            properties.setJobLabel("workers");
            when(schedulerClient.listOwnedJobs()).thenReturn(List.of(
                    remote("job1", "workers:1"),
                    remote("job3", "workers:1"),
                    remote("job5", "other:1")));
            when(jobRepository.findAll()).thenReturn(List.of(job("job1", "@daily"), job("job2", "@hourly")));

            // When
            var results = jobSyncService.resyncAll();

            // Then
            assertThat(results).containsExactly(
                    SyncResult.updated("job1"),
                    SyncResult.updated("job2"),
                    SyncResult.deleted("job3"));

            verify(schedulerClient, times(2)).createOrUpdate(jobCaptor.capture());
            var pushed = jobCaptor.getAllValues();
            assertThat(pushed.get(0).getAdditionalProperties()).containsEntry("success_count", 7);
            assertThat(pushed.get(1).getAdditionalProperties()).isEmpty();

            verify(schedulerClient).deleteJob("job3");
            verify(schedulerClient, never()).deleteJob("job5");
            verify(metricsConfig, times(3)).recordSyncResult(any());
        }

        @Test
        @DisplayName("Should accept a remote label without cardinality suffix")
        void shouldMatchBareLabel() {
            properties.setJobLabel("workers");
            when(schedulerClient.listOwnedJobs()).thenReturn(List.of(remote("job1", "workers")));
            when(jobRepository.findAll()).thenReturn(List.of());

            var results = jobSyncService.resyncAll();

            assertThat(results).containsExactly(SyncResult.deleted("job1"));
        }

        @Test
        @DisplayName("Should only consider remote jobs in its own namespace")
        void shouldRespectNamespace() {
            var service = newService("team");
            when(schedulerClient.listOwnedJobs()).thenReturn(List.of(remote("team_old", null), remote("other_old", null)));
            when(jobRepository.findAll()).thenReturn(List.of(job("job1", "@daily")));

            var results = service.resyncAll();

            assertThat(results).containsExactly(SyncResult.updated("job1"), SyncResult.deleted("old"));
            verify(schedulerClient).deleteJob("team_old");
            verify(schedulerClient, never()).deleteJob("other_old");
        }

        @Test
        @DisplayName("Should push parents before children")
        void shouldPushInDependencyOrder() {
            when(schedulerClient.listOwnedJobs()).thenReturn(List.of());
            when(jobRepository.findAll()).thenReturn(List.of(job("child", "@parent root"), job("root", "@daily")));

            jobSyncService.resyncAll();

            verify(schedulerClient, times(2)).createOrUpdate(jobCaptor.capture());
            assertThat(jobCaptor.getAllValues()).extracting(SchedulerJob::getName).containsExactly("root", "child");
        }

        @Test
        @DisplayName("Should report per-job failures and keep going")
        void shouldContinueAfterFailures() {
            when(schedulerClient.listOwnedJobs()).thenReturn(List.of(remote("gone", null)));
            when(jobRepository.findAll()).thenReturn(List.of(job("bad", "@daily"), job("good", "@daily")));
            doAnswer(invocation -> {
                SchedulerJob pushed = invocation.getArgument(0);
                if ("bad".equals(pushed.getName())) {
                    throw new SchedulerRejectedException(500, "nope");
                }
                return null;
            }).when(schedulerClient).createOrUpdate(any());
            doThrow(new SchedulerUnreachableException("timeout")).when(schedulerClient).deleteJob("gone");

            var streamed = new ArrayList<SyncResult>();
            jobSyncService.resyncAll(streamed::add);

            assertThat(streamed).hasSize(3);
            assertThat(streamed.get(0).getJobName()).isEqualTo("bad");
            assertThat(streamed.get(0).isSuccess()).isFalse();
            assertThat(streamed.get(0).getError()).contains("nope");
            assertThat(streamed.get(1)).isEqualTo(SyncResult.updated("good"));
            assertThat(streamed.get(2).getAction()).isEqualTo(SyncAction.DELETE);
            assertThat(streamed.get(2).getError()).isEqualTo("timeout");
        }

        @Test
        @DisplayName("Should report unresolved jobs without deleting their remote copies")
        void shouldKeepUnresolvedJobs() {
            when(schedulerClient.listOwnedJobs()).thenReturn(List.of(remote("stuck", null)));
            when(jobRepository.findAll()).thenReturn(List.of(job("stuck", "@parent missing")));

            var results = jobSyncService.resyncAll();

            assertThat(results).hasSize(1);
            assertThat(results.get(0).getAction()).isEqualTo(SyncAction.UPDATE);
            assertThat(results.get(0).getError()).contains("missing");
            verify(schedulerClient, never()).createOrUpdate(any());
            verify(schedulerClient, never()).deleteJob(anyString());
        }

        @Test
        @DisplayName("Should abort without changes when the remote list cannot be fetched")
        void shouldAbortWhenListingFails() {
            when(schedulerClient.listOwnedJobs()).thenThrow(new SchedulerUnreachableException("down"));

            assertThatThrownBy(() -> jobSyncService.resyncAll()).isInstanceOf(SchedulerUnreachableException.class);
            verify(schedulerClient, never()).createOrUpdate(any());
            verify(jobRepository, never()).findAll();
        }
    }
}
