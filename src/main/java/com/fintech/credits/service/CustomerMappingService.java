package com.fintech.credits.service;

import com.fintech.credits.entity.CustomerMapping;
import com.fintech.credits.exception.ValidationException;
import com.fintech.credits.repository.CustomerMappingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * (PSP, provider customer id) to subject mapping. Written by setup and subscription events,
 * read by {@link SubjectResolver}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerMappingService {

    private final CustomerMappingRepository repository;

    public Optional<CustomerMapping> getByProviderCustomerId(String provider, String providerCustomerId) {
        if (!StringUtils.hasText(provider) || !StringUtils.hasText(providerCustomerId)) {
            return Optional.empty();
        }
        return repository.findByProviderAndProviderCustomerId(provider, providerCustomerId);
    }

    public Optional<CustomerMapping> getBySubjectId(String provider, UUID subjectId) {
        if (!StringUtils.hasText(provider) || subjectId == null) {
            return Optional.empty();
        }
        return repository.findFirstByProviderAndSubjectIdOrderByCreatedAtDesc(provider, subjectId);
    }

    /**
     * Insert a mapping. A concurrent insert of the same (provider, customer) returns the stored row.
     */
    public CustomerMapping create(String provider, String providerCustomerId, UUID subjectId, String email) {
        if (!StringUtils.hasText(provider) || !StringUtils.hasText(providerCustomerId) || subjectId == null) {
            throw new ValidationException("Provider, provider customer id and subject id are required");
        }
        try {
            CustomerMapping mapping = repository.saveAndFlush(CustomerMapping.builder()
                    .provider(provider)
                    .providerCustomerId(providerCustomerId)
                    .subjectId(subjectId)
                    .email(StringUtils.hasText(email) ? email : null)
                    .build());
            log.info("Mapped {} customer {} to subject {}", provider, providerCustomerId, subjectId);
            return mapping;
        } catch (DataIntegrityViolationException e) {
            return repository.findByProviderAndProviderCustomerId(provider, providerCustomerId)
                    .orElseThrow(() -> e);
        }
    }

    public CustomerMapping update(CustomerMapping mapping) {
        return repository.save(mapping);
    }

    /**
     * Create the mapping if absent; otherwise backfill a missing email. An existing mapping to a
     * different subject is kept and reported.
     */
    public CustomerMapping ensureMapping(String provider, String providerCustomerId, UUID subjectId, String email) {
        Optional<CustomerMapping> existing = getByProviderCustomerId(provider, providerCustomerId);
        if (existing.isEmpty()) {
            return create(provider, providerCustomerId, subjectId, email);
        }

        CustomerMapping mapping = existing.get();
        if (!Objects.equals(mapping.getSubjectId(), subjectId)) {
            log.warn("{} customer {} is mapped to subject {}, not {}; keeping existing mapping",
                    provider, providerCustomerId, mapping.getSubjectId(), subjectId);
            return mapping;
        }
        if (!StringUtils.hasText(mapping.getEmail()) && StringUtils.hasText(email)) {
            mapping.setEmail(email);
            log.info("Backfilled email for {} customer {}", provider, providerCustomerId);
            return update(mapping);
        }
        return mapping;
    }
}
