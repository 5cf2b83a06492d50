package com.example.commerce.infrastructure.adapter.out.payment;

import com.example.commerce.application.port.out.PaymentProvider;
import com.example.commerce.domain.model.PaymentMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed mapping from payment method to gateway, built once at startup.
 * Offline methods have no entry.
 */
public class PaymentProviderRegistry {

    private final Map<PaymentMethod, PaymentProvider> providers;

    public PaymentProviderRegistry(Map<PaymentMethod, PaymentProvider> providers) {
        Map<PaymentMethod, PaymentProvider> copy = new EnumMap<>(PaymentMethod.class);
        providers.forEach((method, provider) -> {
            if (!method.requiresProvider()) {
                throw new IllegalArgumentException("Payment method " + method + " is settled offline");
            }
            copy.put(method, provider);
        });
        this.providers = Collections.unmodifiableMap(copy);
    }

    public Optional<PaymentProvider> find(PaymentMethod method) {
        return Optional.ofNullable(providers.get(method));
    }

    public Map<PaymentMethod, PaymentProvider> asMap() {
        return providers;
    }
}
