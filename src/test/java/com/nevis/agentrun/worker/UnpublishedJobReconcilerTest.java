package com.nevis.agentrun.worker;

import com.nevis.agentrun.model.Job;
import com.nevis.agentrun.model.JobStatus;
import com.nevis.agentrun.repository.JobRepository;
import com.nevis.agentrun.service.JobPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UnpublishedJobReconcilerTest {

    @Mock
    private JobRepository jobRepository;

    @Mock
    private JobPublisher jobPublisher;

    private UnpublishedJobReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new UnpublishedJobReconciler(jobRepository, jobPublisher,
            WorkerFixtures.properties(Map.of("agent-runs", 1)));
        ReflectionTestUtils.setField(reconciler, "batchSize", 50);
    }

    @Test
    @DisplayName("Orphaned PENDING jobs are published again")
    void shouldRepublishOrphans() {
        Job first = WorkerFixtures.job(JobStatus.PENDING);
        Job second = WorkerFixtures.job(JobStatus.PENDING);
        when(jobRepository.findUnpublished(Duration.ofMinutes(2), 50)).thenReturn(List.of(first, second));

        reconciler.reconcile();

        verify(jobPublisher).publish(first);
        verify(jobPublisher).publish(second);
    }

    @Test
    @DisplayName("Stops the batch while the queue is still unavailable")
    void shouldStopWhenQueueUnavailable() {
        Job first = WorkerFixtures.job(JobStatus.PENDING);
        Job second = WorkerFixtures.job(JobStatus.PENDING);
        when(jobRepository.findUnpublished(Duration.ofMinutes(2), 50)).thenReturn(List.of(first, second));
        doThrow(new IllegalStateException("queue down")).when(jobPublisher).publish(first);

        reconciler.reconcile();

        verify(jobPublisher, never()).publish(second);
    }
}
