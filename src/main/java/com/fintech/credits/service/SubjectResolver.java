package com.fintech.credits.service;

import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.dto.NormalizedEvent.SubjectCandidates;
import com.fintech.credits.entity.CustomerMapping;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the subject of a normalized event. Sources are tried in a fixed order and the
 * first valid UUID wins:
 * <ol>
 *   <li>direct payload field ({@code metadata.user_id})</li>
 *   <li>nested parent or expanded sub-object field</li>
 *   <li>first line item field</li>
 *   <li>customer mapping lookup by (provider, provider customer id)</li>
 * </ol>
 * An empty result means the subject is unknown; callers skip the ledger step rather than guess.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubjectResolver {

    private final CustomerMappingService customerMappingService;

    public Optional<UUID> resolve(NormalizedEvent event) {
        SubjectCandidates candidates = event.getSubjectCandidates() == null
                ? SubjectCandidates.builder().build()
                : event.getSubjectCandidates();

        Map<String, String> ordered = new LinkedHashMap<>();
        ordered.put("direct", candidates.getDirect());
        ordered.put("nested", candidates.getNested());
        ordered.put("line item", candidates.getLineItem());

        for (Map.Entry<String, String> candidate : ordered.entrySet()) {
            Optional<UUID> subject = parse(candidate.getValue());
            if (subject.isPresent()) {
                log.debug("Resolved subject {} for event {} from {} field",
                        subject.get(), event.getEventId(), candidate.getKey());
                return subject;
            }
            if (candidate.getValue() != null) {
                log.warn("Ignoring malformed {} user id '{}' on event {}",
                        candidate.getKey(), candidate.getValue(), event.getEventId());
            }
        }

        Optional<UUID> mapped = customerMappingService
                .getByProviderCustomerId(event.getProvider(), event.getProviderCustomerId())
                .map(CustomerMapping::getSubjectId);
        if (mapped.isPresent()) {
            log.debug("Resolved subject {} for event {} from customer mapping of {}",
                    mapped.get(), event.getEventId(), event.getProviderCustomerId());
        }
        return mapped;
    }

    static Optional<UUID> parse(String value) {
        if (value == null || value.trim().length() != 36) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
