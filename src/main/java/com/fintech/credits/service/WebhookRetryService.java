package com.fintech.credits.service;

import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.dto.RetrySweepResult;
import com.fintech.credits.entity.WebhookEvent;
import com.fintech.credits.entity.WebhookProcessingStatus;
import com.fintech.credits.exception.LedgerException;
import com.fintech.credits.exception.ProviderVerificationException;
import com.fintech.credits.service.provider.ProviderAdapterRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Re-applies stored webhook events that are due for another attempt.
 * <p>
 * Each due event is claimed with a conditional PENDING/FAILED to PROCESSING update before it is
 * touched, so concurrent sweepers on different replicas never apply the same event twice.
 * The stored payload was verified on receipt and is re-parsed without a signature check.
 * Events that reached {@code ledger.retry.max-attempts} are left in FAILED for manual review.
 */
@Service
@Slf4j
public class WebhookRetryService {

    private final WebhookEventStore eventStore;
    private final ProviderAdapterRegistry adapterRegistry;
    private final WebhookProcessingService processingService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${ledger.retry.batch-size:50}")
    private int batchSize = 50;

    @Value("${ledger.retry.max-attempts:10}")
    private int maxAttempts = 10;

    @Value("${ledger.retry.stale-claim-minutes:15}")
    private int staleClaimMinutes = 15;

    // Metrics
    private Counter retriedCounter;
    private Counter retryFailureCounter;
    private Timer sweepTimer;

    // Prevents concurrent sweeps in this process
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public WebhookRetryService(WebhookEventStore eventStore,
                               ProviderAdapterRegistry adapterRegistry,
                               WebhookProcessingService processingService,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.eventStore = eventStore;
        this.adapterRegistry = adapterRegistry;
        this.processingService = processingService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        retriedCounter = Counter.builder("ledger.webhooks.retries")
                .description("Stored webhook events re-applied by the retry sweep")
                .register(meterRegistry);

        retryFailureCounter = Counter.builder("ledger.webhooks.retry_failures")
                .description("Retry attempts that failed again")
                .register(meterRegistry);

        sweepTimer = Timer.builder("ledger.webhooks.retry.duration")
                .description("Time taken to complete a retry sweep")
                .register(meterRegistry);
    }

    /**
     * Run one sweep over due events.
     *
     * @throws LedgerException if a sweep is already running in this process
     */
    public RetrySweepResult runSweep() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Webhook retry sweep already in progress, skipping this run");
            throw new LedgerException("Webhook retry sweep already in progress");
        }

        RetrySweepResult result = RetrySweepResult.builder()
                .startedAt(LocalDateTime.now(clock))
                .build();

        try {
            return sweepTimer.record(() -> {
                result.setReleasedStaleClaims(eventStore.releaseStaleClaims(Duration.ofMinutes(staleClaimMinutes)));

                List<WebhookEvent> due = eventStore.getPendingEvents(batchSize, maxAttempts);
                result.setDue(due.size());

                for (WebhookEvent event : due) {
                    retry(event, result);
                }

                result.setCompletedAt(LocalDateTime.now(clock));
                return result;
            });
        } finally {
            isRunning.set(false);
        }
    }

    private void retry(WebhookEvent stored, RetrySweepResult result) {
        if (!eventStore.claim(stored)) {
            log.debug("Webhook {}/{} claimed elsewhere, skipping", stored.getProvider(), stored.getEventId());
            result.incrementSkipped();
            return;
        }
        result.incrementClaimed();
        retriedCounter.increment();

        NormalizedEvent event;
        try {
            event = adapterRegistry.get(stored.getProvider()).parse(stored.getPayload());
        } catch (ProviderVerificationException e) {
            log.error("Stored webhook {}/{} can no longer be parsed: {}",
                    stored.getProvider(), stored.getEventId(), e.getMessage());
            eventStore.markFailed(stored.getProvider(), stored.getEventId(), e.getMessage());
            retryFailureCounter.increment();
            result.addError(stored.getProvider(), stored.getEventId(), e.getMessage());
            return;
        }

        // the stored key is authoritative
        event.setProvider(stored.getProvider());
        event.setEventId(stored.getEventId());

        log.info("Retrying webhook {}/{} (attempt {})",
                stored.getProvider(), stored.getEventId(), stored.getRetryCount() + 1);

        WebhookProcessingStatus outcome = processingService.apply(event);
        if (outcome == WebhookProcessingStatus.COMPLETED) {
            result.incrementCompleted();
        } else {
            retryFailureCounter.increment();
            String error = eventStore.getEvent(stored.getProvider(), stored.getEventId())
                    .map(WebhookEvent::getLastError)
                    .orElse("unknown error");
            result.addError(stored.getProvider(), stored.getEventId(), error);
        }
    }

    /**
     * Get current webhook processing statistics.
     */
    public WebhookStats getStats() {
        return WebhookStats.builder()
                .pendingCount(eventStore.countByStatus(WebhookProcessingStatus.PENDING))
                .processingCount(eventStore.countByStatus(WebhookProcessingStatus.PROCESSING))
                .completedCount(eventStore.countByStatus(WebhookProcessingStatus.COMPLETED))
                .failedCount(eventStore.countByStatus(WebhookProcessingStatus.FAILED))
                .exhaustedCount(eventStore.countExhausted(maxAttempts))
                .maxAttempts(maxAttempts)
                .isSweepRunning(isRunning.get())
                .build();
    }

    @lombok.Data
    @lombok.Builder
    public static class WebhookStats {
        private long pendingCount;
        private long processingCount;
        private long completedCount;
        private long failedCount;

        /**
         * FAILED events at or above max attempts, waiting for manual review.
         */
        private long exhaustedCount;

        private int maxAttempts;
        private boolean isSweepRunning;
    }
}
