package com.aigreentick.services.dealership.queue.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.leads.dto.CalculateLeadScorePayload;
import com.aigreentick.services.dealership.queue.dto.EnqueuedJob;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.DedupePolicy;
import com.aigreentick.services.dealership.queue.enums.JobStatus;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.model.QueueJob;
import com.aigreentick.services.dealership.queue.repository.QueueJobRepository;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class JpaQueueRuntimeTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-10T09:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private QueueJobRepository queueJobRepository;

    @Captor
    private ArgumentCaptor<QueueJob> jobCaptor;

    private JpaQueueRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new JpaQueueRuntime(queueJobRepository, new ObjectMapper(), CLOCK);
    }

    @Test
    @DisplayName("Enqueue stores a waiting job with the type's default attempts")
    void storesJob() {
        when(queueJobRepository.save(any(QueueJob.class))).thenAnswer(invocation -> {
            QueueJob job = invocation.getArgument(0);
            job.setId(11L);
            return job;
        });

        EnqueuedJob enqueued = runtime.enqueue(JobType.SEND_SINGLE_EMAIL,
                CalculateLeadScorePayload.builder().customerId(42L).build(),
                JobOptions.delayed(2, Duration.ofSeconds(30)));

        verify(queueJobRepository).save(jobCaptor.capture());
        QueueJob stored = jobCaptor.getValue();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.WAITING);
        assertThat(stored.getPriority()).isEqualTo(2);
        assertThat(stored.getMaxAttempts()).isEqualTo(JobType.SEND_SINGLE_EMAIL.getDefaultMaxAttempts());
        assertThat(stored.getAvailableAt()).isEqualTo(NOW.plusSeconds(30));
        assertThat(stored.getPayload()).contains("\"customerId\":42");

        assertThat(enqueued.jobId()).isEqualTo(11L);
        assertThat(enqueued.deduplicated()).isFalse();
    }

    @Test
    @DisplayName("A job with a blocking dedupe key returns the existing job")
    void deduplicates() {
        QueueJob existing = QueueJob.builder()
                .id(5L)
                .type(JobType.SEND_SINGLE_EMAIL)
                .priority(2)
                .status(JobStatus.COMPLETED)
                .availableAt(NOW.minusMinutes(10))
                .dedupeKey("abc")
                .build();
        when(queueJobRepository.findFirstByDedupeKeyAndStatusIn("abc", DedupePolicy.ONCE.getBlockingStatuses()))
                .thenReturn(Optional.of(existing));

        EnqueuedJob enqueued = runtime.enqueue(JobType.SEND_SINGLE_EMAIL, "payload",
                JobOptions.builder().dedupeKey("abc").dedupePolicy(DedupePolicy.ONCE).build());

        assertThat(enqueued.deduplicated()).isTrue();
        assertThat(enqueued.jobId()).isEqualTo(5L);
        verify(queueJobRepository, never()).save(any());
    }

    @Test
    @DisplayName("Explicit max attempts override the type default")
    void explicitMaxAttempts() {
        when(queueJobRepository.findFirstByDedupeKeyAndStatusIn("k", DedupePolicy.IN_FLIGHT.getBlockingStatuses()))
                .thenReturn(Optional.empty());
        when(queueJobRepository.save(any(QueueJob.class))).thenAnswer(invocation -> invocation.getArgument(0));

        runtime.enqueue(JobType.ASSIGN_LEAD, "payload",
                JobOptions.builder().maxAttempts(7).dedupeKey("k").build());

        verify(queueJobRepository).save(jobCaptor.capture());
        assertThat(jobCaptor.getValue().getMaxAttempts()).isEqualTo(7);
        assertThat(jobCaptor.getValue().getDedupeKey()).isEqualTo("k");
    }

    @Test
    @DisplayName("An unserializable payload is rejected")
    void unserializablePayload() {
        Object unserializable = new Object();

        assertThatThrownBy(() -> runtime.enqueue(JobType.ASSIGN_LEAD, unserializable))
                .isInstanceOf(InvalidJobPayloadException.class);
        verify(queueJobRepository, never()).save(any());
    }
}
