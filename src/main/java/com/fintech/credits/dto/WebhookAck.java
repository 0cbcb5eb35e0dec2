package com.fintech.credits.dto;

import com.fintech.credits.entity.WebhookProcessingStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement returned to the PSP. Any ack means "do not redeliver";
 * a FAILED status is retried internally.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookAck {

    private boolean accepted;
    private boolean duplicate;
    private String provider;
    private String eventId;
    private String eventType;
    private WebhookProcessingStatus status;
    private String message;
}
