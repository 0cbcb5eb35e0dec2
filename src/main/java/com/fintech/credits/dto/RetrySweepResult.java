package com.fintech.credits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the results of one retry sweep over due webhook events.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrySweepResult {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int due = 0;

    @Builder.Default
    private int claimed = 0;

    @Builder.Default
    private int completed = 0;

    @Builder.Default
    private int failed = 0;

    /**
     * Due events left alone: already claimed elsewhere or out of attempts.
     */
    @Builder.Default
    private int skipped = 0;

    @Builder.Default
    private int releasedStaleClaims = 0;

    @Builder.Default
    private List<SweepError> errorDetails = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SweepError {
        private String provider;
        private String eventId;
        private String errorMessage;
    }

    public void incrementClaimed() {
        this.claimed++;
    }

    public void incrementCompleted() {
        this.completed++;
    }

    public void incrementSkipped() {
        this.skipped++;
    }

    public void addError(String provider, String eventId, String errorMessage) {
        this.failed++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(SweepError.builder()
                .provider(provider)
                .eventId(eventId)
                .errorMessage(errorMessage)
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
