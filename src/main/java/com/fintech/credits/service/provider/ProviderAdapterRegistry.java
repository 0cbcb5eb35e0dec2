package com.fintech.credits.service.provider;

import com.fintech.credits.exception.ProviderVerificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up the {@link PaymentProviderAdapter} for a provider name. Adding a provider means
 * adding an adapter bean; dispatch code never changes.
 */
@Component
@Slf4j
public class ProviderAdapterRegistry {

    private final Map<String, PaymentProviderAdapter> adapters;

    public ProviderAdapterRegistry(List<PaymentProviderAdapter> adapters) {
        this.adapters = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(
                        adapter -> adapter.getProviderName().toLowerCase(Locale.ROOT),
                        Function.identity()));
        log.info("Registered webhook adapters: {}", this.adapters.keySet());
    }

    /**
     * @throws ProviderVerificationException for an unknown provider
     */
    public PaymentProviderAdapter get(String provider) {
        if (provider == null) {
            throw new ProviderVerificationException("Provider is required", null);
        }
        PaymentProviderAdapter adapter = adapters.get(provider.toLowerCase(Locale.ROOT));
        if (adapter == null) {
            throw new ProviderVerificationException("Unsupported payment provider: " + provider, provider);
        }
        return adapter;
    }

    public Set<String> providers() {
        return adapters.keySet();
    }
}
