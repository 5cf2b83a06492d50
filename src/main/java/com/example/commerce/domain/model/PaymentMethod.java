package com.example.commerce.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Payment methods accepted at checkout.
 * Gateway-backed methods carry the slug used by their webhook callbacks.
 */
public enum PaymentMethod {
    CHAPA("chapa"),
    TELEBIRR("telebirr"),
    SANTIM_PAY("santim_pay"),
    CASH_ON_DELIVERY(null),
    BANK_TRANSFER(null);

    private final String providerSlug;

    PaymentMethod(String providerSlug) {
        this.providerSlug = providerSlug;
    }

    /**
     * Whether this method is settled through an external gateway.
     * Offline methods are marked paid immediately.
     */
    public boolean requiresProvider() {
        return providerSlug != null;
    }

    public String getProviderSlug() {
        return providerSlug;
    }

    /**
     * Resolves a webhook path segment such as {@code santim_pay} to its method.
     */
    public static Optional<PaymentMethod> fromProviderSlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        String normalized = slug.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(method -> normalized.equals(method.providerSlug))
                .findFirst();
    }
}
