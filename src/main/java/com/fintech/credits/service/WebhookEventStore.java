package com.fintech.credits.service;

import com.fintech.credits.entity.CanonicalStatus;
import com.fintech.credits.entity.WebhookEvent;
import com.fintech.credits.entity.WebhookProcessingStatus;
import com.fintech.credits.exception.NotFoundException;
import com.fintech.credits.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable record of inbound provider notifications and their retry state.
 * <p>
 * Receipt ({@link #saveEvent}) is decoupled from application ({@link #markProcessed}):
 * an event left in PENDING or FAILED after a crash is picked up again by the retry sweeper.
 * Backoff is computed from persisted state only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookEventStore {

    static final long BASE_BACKOFF_MINUTES = 5;
    static final long MAX_BACKOFF_MINUTES = 24 * 60;

    private static final Set<WebhookProcessingStatus> RETRYABLE =
            EnumSet.of(WebhookProcessingStatus.PENDING, WebhookProcessingStatus.FAILED);

    private final WebhookEventRepository repository;
    private final Clock clock;

    /**
     * Insert-if-absent keyed by (provider, eventId).
     *
     * @return true if a new row was written, false if the event was already stored
     */
    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2)
    )
    public boolean saveEvent(String provider, String eventId, String eventType,
                             CanonicalStatus canonicalStatus, String payload) {
        if (repository.existsByProviderAndEventId(provider, eventId)) {
            log.info("Webhook event {}/{} already stored, ignoring duplicate", provider, eventId);
            return false;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        try {
            repository.saveAndFlush(WebhookEvent.builder()
                    .provider(provider)
                    .eventId(eventId)
                    .eventType(eventType)
                    .canonicalStatus(canonicalStatus)
                    .status(WebhookProcessingStatus.PENDING)
                    .retryCount(0)
                    .payload(payload)
                    .receivedAt(now)
                    .updatedAt(now)
                    .build());
        } catch (DataIntegrityViolationException duplicate) {
            log.info("Webhook event {}/{} stored concurrently, ignoring duplicate", provider, eventId);
            return false;
        }

        log.debug("Stored webhook event {}/{} ({})", provider, eventId, eventType);
        return true;
    }

    public Optional<WebhookEvent> getEvent(String provider, String eventId) {
        return repository.findByProviderAndEventId(provider, eventId);
    }

    /**
     * Terminal success: status COMPLETED, processedAt now.
     *
     * @throws NotFoundException if the event was never stored
     */
    @Transactional
    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2)
    )
    public WebhookEvent markProcessed(String provider, String eventId) {
        WebhookEvent event = find(provider, eventId);
        LocalDateTime now = LocalDateTime.now(clock);

        event.setStatus(WebhookProcessingStatus.COMPLETED);
        event.setProcessedAt(now);
        event.setNextRetryAt(null);
        event.setUpdatedAt(now);

        log.info("Webhook event {}/{} processed", provider, eventId);
        return repository.save(event);
    }

    /**
     * Record a failed attempt: increment retryCount, set status FAILED and schedule
     * the next attempt with exponential backoff (5 min doubling, capped at 24 h).
     *
     * @throws NotFoundException if the event was never stored
     */
    @Transactional
    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2)
    )
    public WebhookEvent markFailed(String provider, String eventId, String error) {
        WebhookEvent event = find(provider, eventId);
        LocalDateTime now = LocalDateTime.now(clock);

        int previousRetryCount = event.getRetryCount() == null ? 0 : event.getRetryCount();
        Duration delay = backoffFor(previousRetryCount);

        event.setRetryCount(previousRetryCount + 1);
        event.setNextRetryAt(now.plus(delay));
        event.setLastError(truncate(error));
        event.setStatus(WebhookProcessingStatus.FAILED);
        event.setUpdatedAt(now);

        log.warn("Webhook event {}/{} failed (attempt {}), next retry in {} min: {}",
                provider, eventId, previousRetryCount + 1, delay.toMinutes(), error);
        return repository.save(event);
    }

    /**
     * Events due for another attempt: PENDING or FAILED with nextRetryAt unset or elapsed,
     * oldest received first.
     */
    public List<WebhookEvent> getPendingEvents(int limit) {
        return getPendingEvents(limit, Integer.MAX_VALUE);
    }

    /**
     * Due events that have not yet exhausted {@code maxAttempts}.
     */
    public List<WebhookEvent> getPendingEvents(int limit, int maxAttempts) {
        return repository.findDue(RETRYABLE, LocalDateTime.now(clock), maxAttempts,
                PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Atomically move a PENDING or FAILED event to PROCESSING.
     *
     * @return false if another delivery or sweeper got there first
     */
    @Transactional
    public boolean claim(WebhookEvent event) {
        return repository.claim(event.getId(), RETRYABLE, WebhookProcessingStatus.PROCESSING,
                LocalDateTime.now(clock)) == 1;
    }

    /**
     * Return PROCESSING claims older than {@code staleAfter} to PENDING.
     */
    @Transactional
    public int releaseStaleClaims(Duration staleAfter) {
        LocalDateTime now = LocalDateTime.now(clock);
        int released = repository.releaseStaleClaims(WebhookProcessingStatus.PROCESSING,
                WebhookProcessingStatus.PENDING, now.minus(staleAfter), now);
        if (released > 0) {
            log.warn("Released {} stale webhook claims older than {} min", released, staleAfter.toMinutes());
        }
        return released;
    }

    public long countByStatus(WebhookProcessingStatus status) {
        return repository.countByStatus(status);
    }

    public long countExhausted(int maxAttempts) {
        return repository.countByStatusAndRetryCountGreaterThanEqual(WebhookProcessingStatus.FAILED, maxAttempts);
    }

    /**
     * {@code min(5 min * 2^previousRetryCount, 24 h)}.
     */
    static Duration backoffFor(int previousRetryCount) {
        int exponent = Math.min(Math.max(previousRetryCount, 0), 30);
        return Duration.ofMinutes(Math.min(BASE_BACKOFF_MINUTES << exponent, MAX_BACKOFF_MINUTES));
    }

    private WebhookEvent find(String provider, String eventId) {
        return repository.findByProviderAndEventId(provider, eventId)
                .orElseThrow(() -> new NotFoundException("Webhook event", provider + "/" + eventId));
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= WebhookEvent.MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, WebhookEvent.MAX_ERROR_LENGTH);
    }
}
