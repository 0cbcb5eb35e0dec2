package com.fintech.credits.scheduler;

import com.fintech.credits.dto.RetrySweepResult;
import com.fintech.credits.exception.LedgerException;
import com.fintech.credits.service.WebhookRetryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic retry sweep over stored webhook events.
 * <p>
 * Disabled by default ({@code ledger.retry.scheduler.enabled}); deployments usually enable it on
 * every replica, claims keep the replicas from applying the same event twice.
 * <p>
 * Default: every minute
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookRetryScheduler {

    private final WebhookRetryService retryService;

    @Value("${ledger.retry.scheduler.enabled:false}")
    private boolean schedulerEnabled;

    /**
     * fixedDelay: the next sweep starts only after the previous one finished.
     */
    @Scheduled(fixedDelayString = "${ledger.retry.scheduler.interval-ms:60000}",
            initialDelayString = "${ledger.retry.scheduler.initial-delay-ms:30000}")
    public void runScheduledSweep() {
        if (!schedulerEnabled) {
            log.debug("Webhook retry scheduler is disabled, skipping sweep");
            return;
        }

        try {
            RetrySweepResult result = retryService.runSweep();
            logResult(result);

            if (result.getFailed() > 0 && result.getFailed() >= result.getClaimed()) {
                log.warn("Every claimed webhook failed again in this sweep: {} of {}",
                        result.getFailed(), result.getClaimed());
            }
        } catch (LedgerException e) {
            log.warn("Webhook retry sweep skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Webhook retry sweep failed with unexpected error", e);
        }
    }

    private void logResult(RetrySweepResult result) {
        if (result.getDue() == 0) {
            log.debug("No webhook events due for retry");
        } else {
            log.info("Webhook retry sweep completed in {}ms: {} due, {} claimed, {} completed, {} failed, {} skipped",
                    result.getDurationMs(),
                    result.getDue(),
                    result.getClaimed(),
                    result.getCompleted(),
                    result.getFailed(),
                    result.getSkipped());
        }
    }
}
