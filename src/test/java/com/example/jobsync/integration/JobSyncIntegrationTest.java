package com.example.jobsync.integration;

import com.example.jobsync.domain.entity.Job;
import com.example.jobsync.domain.repository.JobRepository;
import com.example.jobsync.service.alert.Notifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full application on H2, with a local HTTP server standing in for the scheduler
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Job Sync Integration Tests")
class JobSyncIntegrationTest {

    private static final MockWebServer scheduler = new MockWebServer();

    static {
        try {
            scheduler.start();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void schedulerProperties(DynamicPropertyRegistry registry) {
        registry.add("job-sync.scheduler.url", () -> scheduler.url("/").toString());
    }

    @AfterAll
    static void stopScheduler() throws IOException {
        scheduler.shutdown();
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JobRepository jobRepository;

    @MockBean
    private Notifier notifier;

    @BeforeEach
    void setUp() throws InterruptedException {
        jobRepository.deleteAll();
        while (scheduler.takeRequest(10, TimeUnit.MILLISECONDS) != null) {
            // discard requests left over from a previous test
        }
    }

    private Job givenJob(String name) {
        return jobRepository.save(Job.builder().name(name).schedule("@daily").command("echo " + name).build());
    }

    private RecordedRequest nextSchedulerRequest() throws InterruptedException {
        var request = scheduler.takeRequest(2, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        return request;
    }

    @Nested
    @DisplayName("Job Admin API")
    class JobAdminApiTests {

        @Test
        @DisplayName("Should create a job and push it to the scheduler")
        void shouldCreateAndPush() throws Exception {
            scheduler.enqueue(new MockResponse().setResponseCode(404));
            scheduler.enqueue(new MockResponse().setResponseCode(201));

            mockMvc.perform(post("/api/v1/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"name": "Job1", "schedule": "@daily", "command": "echo hi"}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.name").value("job1"))
                    .andExpect(jsonPath("$.data.wireName").value("job1"))
                    .andExpect(jsonPath("$.data.syncError").doesNotExist());

            assertThat(jobRepository.findByName("job1")).isPresent();

            var fetch = nextSchedulerRequest();
            assertThat(fetch.getMethod()).isEqualTo("GET");
            assertThat(fetch.getPath()).isEqualTo("/v1/jobs/job1");

            var push = nextSchedulerRequest();
            assertThat(push.getMethod()).isEqualTo("POST");
            var body = objectMapper.readTree(push.getBody().readUtf8());
            assertThat(body.get("name").asText()).isEqualTo("job1");
            assertThat(body.get("metadata").get("cron").asText()).isEqualTo("auto");
            assertThat(body.get("executor_config").get("command").asText()).isEqualTo("echo hi");
        }

        @Test
        @DisplayName("Should keep the job when the scheduler rejects it")
        void shouldKeepJobWhenRejected() throws Exception {
            scheduler.enqueue(new MockResponse().setResponseCode(404));
            scheduler.enqueue(new MockResponse().setResponseCode(400).setBody("invalid schedule"));

            mockMvc.perform(post("/api/v1/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"name": "job2", "schedule": "@sometimes", "command": "true"}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.data.syncError").value("HTTP 400: invalid schedule"));

            assertThat(jobRepository.findByName("job2")).isPresent();
        }

        @Test
        @DisplayName("Should reject invalid names without calling the scheduler")
        void shouldRejectInvalidName() throws Exception {
            mockMvc.perform(post("/api/v1/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"name": "bad name", "schedule": "@daily", "command": "true"}
                                    """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false));

            assertThat(jobRepository.count()).isZero();
            assertThat(scheduler.takeRequest(100, TimeUnit.MILLISECONDS)).isNull();
        }

        @Test
        @DisplayName("Should reject schedules starting with a wildcard")
        void shouldRejectWildcardSchedule() throws Exception {
            mockMvc.perform(post("/api/v1/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"name": "job3", "schedule": "* * * * * *", "command": "true"}
                                    """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors[0]").value(containsString("schedule")));
        }

        @Test
        @DisplayName("Should answer 409 for an existing name")
        void shouldRejectDuplicate() throws Exception {
            givenJob("job1");

            mockMvc.perform(post("/api/v1/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"name": "JOB1", "schedule": "@daily", "command": "true"}
                                    """))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("Should answer 404 for an unknown job")
        void shouldReturnNotFound() throws Exception {
            mockMvc.perform(get("/api/v1/jobs/ghost"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("Should update a job and push it")
        void shouldUpdate() throws Exception {
            givenJob("job1");
            scheduler.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json")
                    .setBody("{\"name\": \"job1\", \"schedule\": \"@daily\", \"status\": \"success\"}"));
            scheduler.enqueue(new MockResponse().setResponseCode(201));

            mockMvc.perform(put("/api/v1/jobs/job1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"schedule": "@hourly", "notifyOnError": false}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.schedule").value("@hourly"))
                    .andExpect(jsonPath("$.data.notifyOnError").value(false));

            nextSchedulerRequest();
            var push = objectMapper.readTree(nextSchedulerRequest().getBody().readUtf8());
            assertThat(push.get("schedule").asText()).isEqualTo("@hourly");
            assertThat(push.get("status").asText()).isEqualTo("success");
        }

        @Test
        @DisplayName("Should delete a job locally and remotely")
        void shouldDelete() throws Exception {
            givenJob("job1");
            scheduler.enqueue(new MockResponse().setResponseCode(200));

            mockMvc.perform(delete("/api/v1/jobs/job1"))
                    .andExpect(status().isOk());

            assertThat(jobRepository.findByName("job1")).isEmpty();
            var request = nextSchedulerRequest();
            assertThat(request.getMethod()).isEqualTo("DELETE");
            assertThat(request.getPath()).isEqualTo("/v1/jobs/job1");
        }

        @Test
        @DisplayName("Should disable jobs in bulk")
        void shouldBulkDisable() throws Exception {
            givenJob("job1");
            scheduler.enqueue(new MockResponse().setResponseCode(201));

            mockMvc.perform(post("/api/v1/jobs/bulk/disable")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"names": ["job1"]}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.updated").value(1));

            assertThat(jobRepository.findByName("job1").orElseThrow().isEnabled()).isFalse();
            var push = objectMapper.readTree(nextSchedulerRequest().getBody().readUtf8());
            assertThat(push.get("disabled").asBoolean()).isTrue();
        }
    }

    @Nested
    @DisplayName("Resync API")
    class ResyncApiTests {

        @Test
        @DisplayName("Should push local jobs and delete owned orphans")
        void shouldResync() throws Exception {
            givenJob("job1");
            scheduler.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json")
                    .setBody("""
                            [{"name": "job1", "metadata": {"cron": "auto"}},
                             {"name": "stale", "metadata": {"cron": "auto"}}]
                            """));
            scheduler.enqueue(new MockResponse().setResponseCode(201));
            scheduler.enqueue(new MockResponse().setResponseCode(200));

            mockMvc.perform(post("/api/v1/jobs/resync"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.updated").value(1))
                    .andExpect(jsonPath("$.data.deleted").value(1))
                    .andExpect(jsonPath("$.message").value("1 updated and 1 deleted"));

            assertThat(nextSchedulerRequest().getMethod()).isEqualTo("GET");
            assertThat(nextSchedulerRequest().getMethod()).isEqualTo("POST");
            var delete = nextSchedulerRequest();
            assertThat(delete.getMethod()).isEqualTo("DELETE");
            assertThat(delete.getPath()).isEqualTo("/v1/jobs/stale");
        }

        @Test
        @DisplayName("Should answer 502 when the scheduler refuses to list jobs")
        void shouldFailWhenListingFails() throws Exception {
            scheduler.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

            mockMvc.perform(post("/api/v1/jobs/resync"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.errors[0]").value("boom"));
        }
    }

    @Nested
    @DisplayName("Webhook API")
    class WebhookApiTests {

        @Test
        @DisplayName("Should record a failed run and notify")
        void shouldRecordFailure() throws Exception {
            givenJob("job1");

            mockMvc.perform(post("/api/v1/scheduler/webhook")
                            .contentType(MediaType.TEXT_PLAIN)
                            .content("test-token\njob1\nfalse"))
                    .andExpect(status().isOk());

            var job = jobRepository.findByName("job1").orElseThrow();
            assertThat(job.getLastRunSuccess()).isFalse();
            assertThat(job.getLastRunDate()).isNotNull();
            verify(notifier).notify(eq("job_sync_failed_job"),
                    contains("<http://localhost/scheduler/ui/#/jobs/job1/show/executions|failed>"));
        }

        @Test
        @DisplayName("Should record a successful run")
        void shouldRecordSuccess() throws Exception {
            givenJob("job1");

            mockMvc.perform(post("/api/v1/scheduler/webhook").content("test-token\njob1\ntrue"))
                    .andExpect(status().isOk());

            assertThat(jobRepository.findByName("job1").orElseThrow().getLastRunSuccess()).isTrue();
            verify(notifier, never()).notify(anyString(), anyString());
        }

        @Test
        @DisplayName("Should read a form-encoded post as plain lines")
        void shouldIgnoreFormContentType() throws Exception {
            givenJob("job1");

            mockMvc.perform(post("/api/v1/scheduler/webhook")
                            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                            .content("test-token\njob1\ntrue"))
                    .andExpect(status().isOk());

            assertThat(jobRepository.findByName("job1").orElseThrow().getLastRunSuccess()).isTrue();
        }

        @Test
        @DisplayName("Should answer 403 with an empty body for a wrong token")
        void shouldRejectWrongToken() throws Exception {
            givenJob("job1");

            mockMvc.perform(post("/api/v1/scheduler/webhook").content("nope\njob1\ntrue"))
                    .andExpect(status().isForbidden())
                    .andExpect(content().string(""));
        }

        @Test
        @DisplayName("Should answer 404 for an unknown job")
        void shouldRejectUnknownJob() throws Exception {
            mockMvc.perform(post("/api/v1/scheduler/webhook").content("test-token\nghost\ntrue"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should answer 400 for other methods and malformed bodies")
        void shouldRejectMalformed() throws Exception {
            mockMvc.perform(get("/api/v1/scheduler/webhook"))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(post("/api/v1/scheduler/webhook").content("test-token\njob1"))
                    .andExpect(status().isBadRequest());
        }
    }
}
