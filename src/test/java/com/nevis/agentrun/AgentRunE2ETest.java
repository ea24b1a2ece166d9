package com.nevis.agentrun;

import com.nevis.agentrun.controller.ErrorResponse;
import com.nevis.agentrun.controller.JobListResponse;
import com.nevis.agentrun.controller.JobResponse;
import com.nevis.agentrun.controller.RunResponse;
import com.nevis.agentrun.exception.RetriableExecutionException;
import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.model.JobStatus;
import com.nevis.agentrun.model.SessionUpdate;
import com.nevis.agentrun.model.UsageMetrics;
import com.nevis.agentrun.queue.TaskMessage;
import com.nevis.agentrun.queue.TaskQueue;
import com.nevis.agentrun.repository.BaseIntegrationTest;
import com.nevis.agentrun.repository.JobRepository;
import com.nevis.agentrun.repository.SessionRepository;
import com.nevis.agentrun.toolkit.Toolkit;
import com.nevis.agentrun.toolkit.ToolkitResult;
import com.nevis.agentrun.worker.UnpublishedJobReconciler;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "app.gemini.api-key=fake-key-value-for-testing",
        "app.worker.enabled=true",
        "app.worker.initial-backoff=1ms",
        "app.worker.max-backoff=5ms",
        "app.worker.poll-wait=100ms",
        "app.worker.redelivery-delay=200ms",
        "app.queue.poll-interval=20ms",
        "app.maintenance.enabled=true",
        "app.maintenance.reclaim-interval-ms=3600000",
        "app.maintenance.reconcile-interval-ms=3600000"
    }
)
class AgentRunE2ETest extends BaseIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private JdbcClient jdbcClient;

    @Autowired
    private SessionRepository sessionRepository;

    @Autowired
    private JobRepository jobRepository;

    @MockitoSpyBean
    private TaskQueue taskQueue;

    @Autowired
    private UnpublishedJobReconciler reconciler;

    @MockitoBean
    private Toolkit toolkit;

    @Value("${app.security.jwt-secret}")
    private String jwtSecret;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("DELETE FROM task_messages").update();
        jdbcClient.sql("DELETE FROM jobs").update();
        jdbcClient.sql("DELETE FROM sessions").update();

        sessionRepository.upsert("alice", new SessionUpdate(
            Map.of("access_token", "token", "refresh_token", "refresh"),
            Set.of("drive", "gmail_full"),
            Set.of("drive"),
            true,
            Map.of("email", "alice@example.com")
        ));
    }

    @Test
    @DisplayName("Submitted job runs on a worker and the caller sees the result")
    void shouldRunSubmittedJobToCompletion() {
        when(toolkit.execute(anyString(), anyMap(), any()))
            .thenReturn(new ToolkitResult("You have 2 files", UsageMetrics.of(30, 6)));

        UUID jobId = submit("alice", "list my drive files");

        JobResponse job = awaitTerminal("alice", jobId);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.result()).isEqualTo("You have 2 files");
        assertThat(job.tokenUsage()).isEqualTo(new UsageMetrics(30, 6, 36));
        assertThat(job.completedAt()).isNotNull();

        verify(toolkit).execute(eq("list my drive files"), anyMap(),
            argThat(credentials -> credentials.allowedScopes().equals(Set.of("drive"))));
    }

    @Test
    @DisplayName("Two transient failures are retried and the job completes with the third answer")
    void shouldRetryTransientFailures() {
        when(toolkit.execute(anyString(), anyMap(), any()))
            .thenThrow(new RetriableExecutionException("rate limited"))
            .thenThrow(new RetriableExecutionException("rate limited"))
            .thenReturn(new ToolkitResult("finally", UsageMetrics.of(1, 1)));

        UUID jobId = submit("alice", "retry me");

        JobResponse job = awaitTerminal("alice", jobId);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.result()).isEqualTo("finally");
        assertThat(job.attempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Redelivering the task of a completed job changes nothing")
    void shouldIgnoreRedeliveryAfterCompletion() {
        when(toolkit.execute(anyString(), anyMap(), any()))
            .thenReturn(new ToolkitResult("first answer", UsageMetrics.of(1, 1)));
        UUID jobId = submit("alice", "once only");
        awaitTerminal("alice", jobId);
        Job completed = jobRepository.findById(jobId).orElseThrow();

        taskQueue.publish(completed.queueName(), TaskMessage.from(completed));
        await().atMost(Duration.ofSeconds(10)).until(() -> taskQueue.depth(completed.queueName()) == 0);

        Job after = jobRepository.findById(jobId).orElseThrow();
        assertThat(after.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(after.result()).isEqualTo("first answer");
        assertThat(after.completedAt()).isEqualTo(completed.completedAt());
        verify(toolkit, times(1)).execute(anyString(), anyMap(), any());
    }

    @Test
    @DisplayName("Jobs are invisible to other users")
    void shouldHideJobsFromOtherOwners() {
        when(toolkit.execute(anyString(), anyMap(), any()))
            .thenReturn(new ToolkitResult("private", UsageMetrics.of(1, 1)));
        UUID jobId = submit("alice", "my secret");

        ResponseEntity<String> response = restTemplate.exchange("/result/" + jobId, HttpMethod.GET,
            new HttpEntity<>(authHeaders("mallory")), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    @DisplayName("A stored job that never reached the queue is picked up by reconciliation")
    void shouldReconcileUnpublishedJob() {
        when(toolkit.execute(anyString(), anyMap(), any()))
            .thenReturn(new ToolkitResult("recovered", UsageMetrics.of(1, 1)));
        Job orphan = jobRepository.save(Job.pending("alice", "lost in transit", Map.of(), "agent-runs"));
        jdbcClient.sql("UPDATE jobs SET created_at = NOW() - INTERVAL '10 minutes' WHERE id = :id")
            .param("id", orphan.id())
            .update();

        reconciler.reconcile();

        JobResponse job = awaitTerminal("alice", orphan.id());
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.result()).isEqualTo("recovered");
    }

    @Test
    @DisplayName("Queue outage on submit hands back the stored job, which reconciliation runs exactly once")
    void shouldRunJobOnceAfterPublishFailure() {
        when(toolkit.execute(anyString(), anyMap(), any()))
            .thenReturn(new ToolkitResult("sent once", UsageMetrics.of(1, 1)));
        doThrow(new DataAccessResourceFailureException("queue unavailable"))
            .when(taskQueue).publish(anyString(), any(TaskMessage.class));

        ResponseEntity<ErrorResponse> rejected = restTemplate.exchange("/run", HttpMethod.POST,
            new HttpEntity<>(Map.of("message", "email the team"), authHeaders("alice")), ErrorResponse.class);

        assertThat(rejected.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        UUID jobId = rejected.getBody().jobId();
        assertThat(jobId).isNotNull();
        assertThat(rejected.getBody().message()).contains("do not resubmit");
        assertThat(jobRepository.findById(jobId).orElseThrow().status()).isEqualTo(JobStatus.PENDING);

        doCallRealMethod().when(taskQueue).publish(anyString(), any(TaskMessage.class));
        jdbcClient.sql("UPDATE jobs SET created_at = NOW() - INTERVAL '10 minutes' WHERE id = :id")
            .param("id", jobId)
            .update();
        reconciler.reconcile();

        JobResponse job = awaitTerminal("alice", jobId);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.result()).isEqualTo("sent once");

        JobListResponse jobs = restTemplate.exchange("/jobs", HttpMethod.GET,
            new HttpEntity<>(authHeaders("alice")), JobListResponse.class).getBody();
        assertThat(jobs.total()).isEqualTo(1);
        verify(toolkit, times(1)).execute(anyString(), anyMap(), any());
    }

    private UUID submit(String ownerId, String message) {
        ResponseEntity<RunResponse> response = restTemplate.exchange("/run", HttpMethod.POST,
            new HttpEntity<>(Map.of("message", message), authHeaders(ownerId)), RunResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        return response.getBody().jobId();
    }

    private JobResponse awaitTerminal(String ownerId, UUID jobId) {
        return await().atMost(Duration.ofSeconds(20)).pollInterval(Duration.ofMillis(100)).until(
            () -> restTemplate.exchange("/result/" + jobId, HttpMethod.GET,
                new HttpEntity<>(authHeaders(ownerId)), JobResponse.class).getBody(),
            job -> job != null && (job.status() == JobStatus.COMPLETED || job.status() == JobStatus.FAILED));
    }

    private HttpHeaders authHeaders(String subject) {
        SecretKeySpec key = new SecretKeySpec(jwtSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        NimbusJwtEncoder encoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
        JwtClaimsSet claims = JwtClaimsSet.builder()
            .subject(subject)
            .issuedAt(Instant.now())
            .expiresAt(Instant.now().plusSeconds(300))
            .build();
        String token = encoder.encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims))
            .getTokenValue();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        return headers;
    }
}
