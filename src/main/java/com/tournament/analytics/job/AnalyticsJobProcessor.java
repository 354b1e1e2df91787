package com.tournament.analytics.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobStatus;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobType;
import com.tournament.analytics.infrastructure.persistence.repository.AnalyticsJobRepository;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent background job runner for aggregation, scheduled reports and cache warm-up.
 *
 * Processing Flow:
 * 1. Submitters store a PENDING job with a JSON payload
 * 2. The poller picks up PENDING jobs whose next attempt time has passed
 * 3. The job is marked RUNNING and dispatched to the handler for its type
 * 4. Handler progress (0-100) is saved as it is reported
 * 5. The result is stored as JSON and the job marked COMPLETED
 *
 * Failure Handling:
 * - A failed attempt goes back to PENDING with an exponential backoff delay
 * - After the last attempt the job is FAILED and the handler's onExhausted hook runs
 */
@Slf4j
@Service
public class AnalyticsJobProcessor {

    private static final List<JobStatus> ACTIVE = List.of(JobStatus.PENDING, JobStatus.RUNNING);

    private final AnalyticsJobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final IntervalFunction jobBackoff;
    private final Clock clock;
    private final Map<JobType, AnalyticsJobHandler<?>> handlers = new EnumMap<>(JobType.class);

    private final Counter completedCounter;
    private final Counter retriedCounter;
    private final Counter failedCounter;

    private final int maxAttempts;

    public AnalyticsJobProcessor(AnalyticsJobRepository jobRepository,
                                 ObjectMapper objectMapper,
                                 IntervalFunction jobBackoff,
                                 Clock clock,
                                 List<AnalyticsJobHandler<?>> handlers,
                                 MeterRegistry meterRegistry,
                                 @Value("${app.jobs.max-attempts:3}") int maxAttempts) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.jobBackoff = jobBackoff;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        for (AnalyticsJobHandler<?> handler : handlers) {
            this.handlers.put(handler.type(), handler);
        }

        this.completedCounter = jobCounter(meterRegistry, "completed");
        this.retriedCounter = jobCounter(meterRegistry, "retried");
        this.failedCounter = jobCounter(meterRegistry, "failed");
    }

    /**
     * Stores a new job and returns its id.
     */
    @Transactional
    public UUID submitJob(JobType type, Object payload) {
        return enqueue(type, payload, null)
                .orElseThrow(() -> new IllegalStateException("Job without dedupe key was not enqueued"));
    }

    /**
     * Stores a new job unless a PENDING or RUNNING job with the same dedupe key exists.
     * Returns empty for a duplicate.
     */
    @Transactional
    public Optional<UUID> enqueue(JobType type, Object payload, String dedupeKey) {
        if (!handlers.containsKey(type)) {
            throw new AnalyticsValidationException("No handler registered for job type " + type);
        }
        if (dedupeKey != null && jobRepository.existsByDedupeKeyAndStatusIn(dedupeKey, ACTIVE)) {
            log.debug("Job {} already queued, skipping", dedupeKey);
            return Optional.empty();
        }

        AnalyticsJobEntity job = AnalyticsJobEntity.builder()
                .jobType(type)
                .payload(toJson(payload))
                .dedupeKey(dedupeKey)
                .maxAttempts(maxAttempts)
                .createdAt(clock.instant())
                .build();
        job = jobRepository.save(job);

        log.info("Job submitted: {} (type: {})", job.getJobId(), type);
        return Optional.of(job.getJobId());
    }

    @Transactional(readOnly = true)
    public AnalyticsJobEntity getJobStatus(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }

    @Scheduled(fixedDelayString = "${app.jobs.poll-delay-ms:1000}")
    public void processPendingJobs() {
        List<AnalyticsJobEntity> pendingJobs = jobRepository
                .findTop10ByStatusAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(JobStatus.PENDING, clock.instant());
        if (pendingJobs.isEmpty()) {
            return;
        }

        log.debug("Processing {} pending jobs", pendingJobs.size());
        for (AnalyticsJobEntity job : pendingJobs) {
            processJob(job);
        }
    }

    /**
     * Runs one attempt of a job and records its outcome.
     */
    public void processJob(AnalyticsJobEntity job) {
        log.info("Processing job: {} (type: {}, attempt {}/{})",
                job.getJobId(), job.getJobType(), job.getAttempts() + 1, job.getMaxAttempts());

        job.markStarted(clock.instant());
        jobRepository.save(job);

        AnalyticsJobHandler<?> handler = handlers.get(job.getJobType());
        try {
            if (handler == null) {
                throw new AnalyticsValidationException("No handler registered for job type " + job.getJobType());
            }
            Object result = execute(handler, job);

            job.markCompleted(toJson(result), clock.instant());
            jobRepository.save(job);
            completedCounter.increment();

            log.info("Job completed: {} ({} ms)", job.getJobId(), job.getExecutionTimeMs());

        } catch (RuntimeException e) {
            handleFailure(job, handler, e);
        }
    }

    private <P> Object execute(AnalyticsJobHandler<P> handler, AnalyticsJobEntity job) {
        P payload = fromJson(job.getPayload(), handler.payloadType());
        return handler.handle(payload, percent -> {
            job.setProgress(Math.max(0, Math.min(100, percent)));
            jobRepository.save(job);
        });
    }

    private void handleFailure(AnalyticsJobEntity job, AnalyticsJobHandler<?> handler, RuntimeException e) {
        if (job.hasAttemptsLeft()) {
            long delayMs = jobBackoff.apply(job.getAttempts());
            Instant nextAttempt = clock.instant().plusMillis(delayMs);
            log.warn("Job {} attempt {} failed, retrying at {}: {}",
                    job.getJobId(), job.getAttempts(), nextAttempt, e.getMessage());
            job.scheduleRetry(e.getMessage(), nextAttempt);
            jobRepository.save(job);
            retriedCounter.increment();
            return;
        }

        log.error("Job {} failed after {} attempts: {}", job.getJobId(), job.getAttempts(), e.getMessage(), e);
        job.markFailed(e.getMessage(), clock.instant());
        jobRepository.save(job);
        failedCounter.increment();

        if (handler != null) {
            exhausted(handler, job);
        }
    }

    private <P> void exhausted(AnalyticsJobHandler<P> handler, AnalyticsJobEntity job) {
        try {
            handler.onExhausted(fromJson(job.getPayload(), handler.payloadType()));
        } catch (RuntimeException e) {
            log.error("Exhausted-job hook failed for job {}: {}", job.getJobId(), e.getMessage(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AnalyticsValidationException("Job data is not serializable: " + e.getOriginalMessage());
        }
    }

    private <P> P fromJson(String json, Class<P> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new AnalyticsValidationException("Invalid job payload: " + e.getOriginalMessage());
        }
    }

    private static Counter jobCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("analytics.jobs")
                .tag("outcome", outcome)
                .description("Background job attempts by outcome")
                .register(registry);
    }
}
