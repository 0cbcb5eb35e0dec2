package com.fintech.credits.service;

import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.dto.NormalizedEvent.SubjectCandidates;
import com.fintech.credits.entity.CustomerMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubjectResolverTest {

    private static final UUID DIRECT = UUID.fromString("11111111-1111-4111-8111-111111111111");
    private static final UUID NESTED = UUID.fromString("22222222-2222-4222-8222-222222222222");
    private static final UUID LINE_ITEM = UUID.fromString("33333333-3333-4333-8333-333333333333");
    private static final UUID MAPPED = UUID.fromString("44444444-4444-4444-8444-444444444444");

    @Mock
    private CustomerMappingService customerMappingService;

    private SubjectResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new SubjectResolver(customerMappingService);
    }

    @Test
    @DisplayName("Should prefer the direct field over every other source")
    void shouldPreferDirectField() {
        NormalizedEvent event = event(DIRECT.toString(), NESTED.toString(), LINE_ITEM.toString());

        assertThat(resolver.resolve(event)).contains(DIRECT);
        verifyNoInteractions(customerMappingService);
    }

    @Test
    @DisplayName("Should skip malformed ids and fall through to the next source")
    void shouldSkipMalformedIds() {
        NormalizedEvent event = event("user-42", " " + NESTED + " ", LINE_ITEM.toString());

        assertThat(resolver.resolve(event)).contains(NESTED);
    }

    @Test
    @DisplayName("Should use the line item when payload fields are absent or invalid")
    void shouldFallBackToLineItem() {
        NormalizedEvent event = event(null, "not-a-uuid-but-exactly-36-characters", LINE_ITEM.toString());

        assertThat(resolver.resolve(event)).contains(LINE_ITEM);
    }

    @Test
    @DisplayName("Should fall back to the customer mapping")
    void shouldFallBackToCustomerMapping() {
        NormalizedEvent event = event(null, null, null);
        when(customerMappingService.getByProviderCustomerId("stripe", "cus_1"))
                .thenReturn(Optional.of(CustomerMapping.builder().subjectId(MAPPED).build()));

        assertThat(resolver.resolve(event)).contains(MAPPED);
    }

    @Test
    @DisplayName("Should resolve nothing when no source yields a subject")
    void shouldResolveNothing() {
        NormalizedEvent event = event("", null, "abc");
        when(customerMappingService.getByProviderCustomerId("stripe", "cus_1")).thenReturn(Optional.empty());

        assertThat(resolver.resolve(event)).isEmpty();
    }

    @Test
    @DisplayName("Should accept only 36 character UUID strings")
    void shouldParseStrictly() {
        assertThat(SubjectResolver.parse(DIRECT.toString())).contains(DIRECT);
        assertThat(SubjectResolver.parse("1-1-1-1-1")).isEmpty();
        assertThat(SubjectResolver.parse(null)).isEmpty();
        assertThat(SubjectResolver.parse("zzzzzzzz-zzzz-zzzz-zzzz-zzzzzzzzzzzz")).isEmpty();
    }

    private NormalizedEvent event(String direct, String nested, String lineItem) {
        return NormalizedEvent.builder()
                .provider("stripe")
                .eventId("evt_1")
                .providerCustomerId("cus_1")
                .subjectCandidates(SubjectCandidates.builder()
                        .direct(direct)
                        .nested(nested)
                        .lineItem(lineItem)
                        .build())
                .build();
    }
}
