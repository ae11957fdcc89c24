package com.delta.opportunities.pipeline.submission;

import com.delta.opportunities.config.PipelineProperties;
import com.delta.opportunities.pipeline.error.TransientException;
import com.delta.opportunities.pipeline.external.PlatformAdapter;
import com.delta.opportunities.pipeline.external.PlatformAdapterRegistry;
import com.delta.opportunities.pipeline.model.ApplicationPackage;
import com.delta.opportunities.pipeline.model.DeliveryReceipt;
import com.delta.opportunities.pipeline.model.PlatformQueueStats;
import com.delta.opportunities.pipeline.model.SubmissionAttempt;
import com.delta.opportunities.pipeline.model.SubmissionResult;
import com.delta.opportunities.pipeline.model.SubmissionStatus;
import com.delta.opportunities.pipeline.persistence.SubmissionAttemptRepository;
import com.delta.opportunities.pipeline.retry.RetryPolicy;
import com.delta.opportunities.pipeline.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers approved application packages to platforms. Each platform gets its own bounded
 * priority queue, worker pool and token bucket. Attempts are durable: queue contents can be
 * rebuilt from {@code submission_attempts} after a restart.
 */
@Service
public class SubmissionEngine {
    private static final Logger log = LoggerFactory.getLogger(SubmissionEngine.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);
    private static final int RECOVERY_BATCH = 1000;

    private final SubmissionAttemptRepository repository;
    private final PlatformAdapterRegistry adapterRegistry;
    private final PipelineProperties properties;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Map<String, PlatformLane> lanes = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private volatile SubmissionListener listener;

    public SubmissionEngine(
        SubmissionAttemptRepository repository,
        PlatformAdapterRegistry adapterRegistry,
        PipelineProperties properties,
        @Qualifier("pipelineScheduler") ScheduledExecutorService scheduler,
        Clock clock
    ) {
        this.repository = repository;
        this.adapterRegistry = adapterRegistry;
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            running.set(true);
            for (String platform : properties.getSubmission().getPlatforms().keySet()) {
                lane(platform);
            }
            for (String platform : adapterRegistry.platforms()) {
                lane(platform);
            }
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            for (PlatformLane lane : lanes.values()) {
                lane.workers.shutdownNow();
            }
            for (PlatformLane lane : lanes.values()) {
                try {
                    lane.workers.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }
            lanes.clear();
        }
    }

    public void registerListener(SubmissionListener submissionListener) {
        this.listener = submissionListener;
    }

    /**
     * Queues delivery of the package. Submitting the same (application, platform) again
     * returns the attempt that already exists for it.
     *
     * @return the submission attempt id
     */
    public long submit(ApplicationPackage applicationPackage, String platform) {
        String platformKey = normalizePlatform(platform);
        String idempotencyKey = HashUtils.idempotencyKey(applicationPackage.applicationId(), platformKey);
        SubmissionAttemptRepository.CreateResult result = repository.createIfAbsent(
            applicationPackage,
            platformKey,
            idempotencyKey,
            clock.instant()
        );
        SubmissionAttempt attempt = result.attempt();
        if (!result.created()) {
            log.info(
                "Submission for application {} on {} already exists as attempt {} ({})",
                applicationPackage.applicationId(),
                platformKey,
                attempt.id(),
                attempt.status()
            );
            return attempt.id();
        }
        log.info("Queued application {} for {} as attempt {}", applicationPackage.applicationId(), platformKey, attempt.id());
        enqueue(attempt);
        return attempt.id();
    }

    /**
     * Expires attempts of the application that have not been handed to the platform yet.
     */
    public int withdraw(long applicationId) {
        int expired = repository.expireWaiting(applicationId, clock.instant());
        for (PlatformLane lane : lanes.values()) {
            lane.queue.removeApplication(applicationId);
        }
        if (expired > 0) {
            log.info("Withdrew {} queued submission attempt(s) for application {}", expired, applicationId);
        }
        return expired;
    }

    public Optional<SubmissionAttempt> findAttempt(long applicationId, String platform) {
        String platformKey = normalizePlatform(platform);
        return repository.findByIdempotencyKey(HashUtils.idempotencyKey(applicationId, platformKey));
    }

    public List<SubmissionAttempt> attemptsFor(long applicationId) {
        return repository.findByApplication(applicationId);
    }

    public List<PlatformQueueStats> queueStats() {
        List<PlatformQueueStats> stats = new ArrayList<>();
        for (PlatformLane lane : lanes.values()) {
            stats.add(new PlatformQueueStats(
                lane.platform,
                lane.queue.size(),
                lane.queue.capacity(),
                lane.workerCount,
                lane.limiter.availableTokens()
            ));
        }
        stats.sort((left, right) -> left.platform().compareTo(right.platform()));
        return stats;
    }

    /**
     * Re-queues every non-terminal attempt found in the store. Attempts caught in flight by a
     * crash are retried with the same idempotency key.
     */
    public int recover() {
        List<SubmissionAttempt> open = repository.findNonTerminal(RECOVERY_BATCH);
        Instant now = clock.instant();
        for (SubmissionAttempt attempt : open) {
            if (attempt.status() == SubmissionStatus.IN_FLIGHT) {
                repository.markRetryScheduled(attempt.id(), now, "recovered_after_restart", now);
            }
            enqueue(attempt);
        }
        if (!open.isEmpty()) {
            log.info("Recovered {} open submission attempt(s)", open.size());
        }
        return open.size();
    }

    private void enqueue(SubmissionAttempt attempt) {
        if (!running.get()) {
            return;
        }
        PlatformLane lane = lane(attempt.platform());
        ApplicationPackage pkg = attempt.applicationPackage();
        boolean accepted = lane.queue.offer(attempt.id(), attempt.applicationId(), pkg.tier(), pkg.deadline());
        if (accepted) {
            return;
        }
        if (lane.queue.size() < lane.queue.capacity()) {
            // already queued
            return;
        }
        Duration delay = properties.getSubmission().retryPolicy().baseDelay();
        Instant now = clock.instant();
        if (repository.markRetryScheduled(attempt.id(), now.plus(delay), "queue_full", now)) {
            log.warn("Submission queue for {} is full; deferring attempt {} by {}", lane.platform, attempt.id(), delay);
            scheduleRequeue(attempt.id(), delay);
        }
    }

    private void scheduleRequeue(long attemptId, Duration delay) {
        try {
            scheduler.schedule(() -> requeue(attemptId), Math.max(1L, delay.toMillis()), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule retry of submission attempt {}; it will be recovered on restart", attemptId, e);
        }
    }

    private void requeue(long attemptId) {
        try {
            repository.findById(attemptId)
                .filter(attempt -> !attempt.status().isTerminal())
                .ifPresent(this::enqueue);
        } catch (Exception e) {
            log.warn("Failed to requeue submission attempt {}", attemptId, e);
        }
    }

    private void workerLoop(PlatformLane lane, int workerIndex) {
        Thread.currentThread().setName("submission-" + lane.platform + "-" + workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            QueuedSubmission next;
            try {
                next = lane.queue.poll(POLL_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (next == null) {
                continue;
            }
            try {
                process(lane, next.attemptId());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.warn("Submission worker {} on {} failed on attempt {}", workerIndex, lane.platform, next.attemptId(), e);
            }
        }
    }

    private void process(PlatformLane lane, long attemptId) throws InterruptedException {
        SubmissionAttempt attempt = repository.findById(attemptId).orElse(null);
        if (attempt == null || attempt.status().isTerminal()) {
            return;
        }
        int attemptNumber = attempt.attemptNumber() + 1;
        if (!repository.markInFlight(attemptId, attemptNumber, clock.instant())) {
            return;
        }
        try {
            deliver(lane, attempt, attemptNumber);
        } catch (RuntimeException e) {
            log.warn("Submission attempt {} on {} broke off while in flight; recovering it", attemptId, lane.platform, e);
            scheduleInFlightRecovery(attemptId, attemptNumber);
        }
    }

    private void deliver(PlatformLane lane, SubmissionAttempt attempt, int attemptNumber) throws InterruptedException {
        long attemptId = attempt.id();
        PlatformAdapter adapter = adapterRegistry.find(lane.platform).orElse(null);
        if (adapter == null) {
            fail(attempt, attemptNumber, "no adapter configured for platform " + lane.platform);
            return;
        }
        lane.limiter.acquire();
        DeliveryReceipt receipt;
        try {
            receipt = adapter.deliver(attempt.applicationPackage(), attempt.idempotencyKey());
        } catch (RuntimeException e) {
            handleFailure(attempt, attemptNumber, e);
            return;
        }
        Instant now = clock.instant();
        if (repository.markDelivered(attemptId, receipt.deliveryId(), now)) {
            log.info(
                "Delivered application {} to {} (attempt {}, delivery {}{})",
                attempt.applicationId(),
                lane.platform,
                attemptNumber,
                receipt.deliveryId(),
                receipt.duplicate() ? ", duplicate" : ""
            );
            notifyListener(new SubmissionResult(
                attempt.applicationId(),
                attemptId,
                lane.platform,
                SubmissionStatus.DELIVERED,
                receipt.deliveryId(),
                null,
                attemptNumber
            ));
        }
    }

    /**
     * Puts an attempt left {@code IN_FLIGHT} by a store failure back on its queue. The
     * platform sees the same idempotency key again, so a delivery that did land is not repeated.
     */
    private void scheduleInFlightRecovery(long attemptId, int attemptNumber) {
        Duration delay = properties.getSubmission().retryPolicy().delayAfter(attemptNumber);
        try {
            scheduler.schedule(
                () -> recoverInFlight(attemptId, attemptNumber),
                Math.max(1L, delay.toMillis()),
                TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule recovery of submission attempt {}; it will be recovered on restart", attemptId, e);
        }
    }

    private void recoverInFlight(long attemptId, int attemptNumber) {
        if (!running.get()) {
            return;
        }
        try {
            Optional<SubmissionAttempt> attempt = repository.findById(attemptId);
            if (attempt.isEmpty() || attempt.get().status() != SubmissionStatus.IN_FLIGHT) {
                return;
            }
            Instant now = clock.instant();
            repository.markRetryScheduled(attemptId, now, "recovered_after_worker_error", now);
            requeue(attemptId);
        } catch (RuntimeException e) {
            log.warn("Recovery of submission attempt {} failed; trying again", attemptId, e);
            scheduleInFlightRecovery(attemptId, attemptNumber);
        }
    }

    private void handleFailure(SubmissionAttempt attempt, int attemptNumber, RuntimeException error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        RetryPolicy policy = properties.getSubmission().retryPolicy();
        if (!(error instanceof TransientException) || !policy.canRetryAfter(attemptNumber)) {
            fail(attempt, attemptNumber, message);
            return;
        }
        Instant now = clock.instant();
        Duration delay = policy.delayAfter(attemptNumber);
        if (repository.markRetryScheduled(attempt.id(), now.plus(delay), message, now)) {
            log.warn(
                "Delivery attempt {} of application {} to {} failed ({}); retrying in {}",
                attemptNumber,
                attempt.applicationId(),
                attempt.platform(),
                message,
                delay
            );
            scheduleRequeue(attempt.id(), delay);
        }
    }

    private void fail(SubmissionAttempt attempt, int attemptNumber, String message) {
        if (!repository.markFailed(attempt.id(), message, clock.instant())) {
            return;
        }
        log.warn(
            "Submission of application {} to {} failed after {} attempt(s): {}",
            attempt.applicationId(),
            attempt.platform(),
            attemptNumber,
            message
        );
        notifyListener(new SubmissionResult(
            attempt.applicationId(),
            attempt.id(),
            attempt.platform(),
            SubmissionStatus.FAILED,
            null,
            message,
            attemptNumber
        ));
    }

    private void notifyListener(SubmissionResult result) {
        SubmissionListener current = listener;
        if (current == null) {
            log.warn("No submission listener registered; result for application {} not forwarded", result.applicationId());
            return;
        }
        try {
            current.onSubmissionResult(result);
        } catch (Exception e) {
            log.warn("Submission listener failed for application {}", result.applicationId(), e);
        }
    }

    private PlatformLane lane(String platform) {
        String key = normalizePlatform(platform);
        return lanes.computeIfAbsent(key, this::createLane);
    }

    private PlatformLane createLane(String platform) {
        PipelineProperties.Platform config = properties.getSubmission().platform(platform);
        int workerCount = config.getWorkers();
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("submission-" + platform + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        PlatformLane lane = new PlatformLane(
            platform,
            new PlatformSubmissionQueue(platform, config.getQueueCapacity()),
            new TokenBucketRateLimiter(config.getRatePerSecond(), config.getBurst()),
            workers,
            workerCount
        );
        for (int i = 0; i < workerCount; i++) {
            int workerIndex = i + 1;
            workers.submit(() -> workerLoop(lane, workerIndex));
        }
        log.info("Started {} submission worker(s) for platform {}", workerCount, platform);
        return lane;
    }

    private String normalizePlatform(String platform) {
        String value = platform == null || platform.isBlank() ? properties.getSubmission().getDefaultPlatform() : platform;
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private record PlatformLane(
        String platform,
        PlatformSubmissionQueue queue,
        TokenBucketRateLimiter limiter,
        ExecutorService workers,
        int workerCount
    ) {
    }
}
