package com.fintech.credits.repository;

import com.fintech.credits.entity.CustomerMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerMappingRepository extends JpaRepository<CustomerMapping, Long> {

    Optional<CustomerMapping> findByProviderAndProviderCustomerId(String provider, String providerCustomerId);

    Optional<CustomerMapping> findFirstByProviderAndSubjectIdOrderByCreatedAtDesc(String provider, UUID subjectId);
}
