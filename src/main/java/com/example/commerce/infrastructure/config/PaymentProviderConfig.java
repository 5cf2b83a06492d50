package com.example.commerce.infrastructure.config;

import com.example.commerce.application.port.out.PaymentProvider;
import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.infrastructure.adapter.out.payment.MockPaymentProvider;
import com.example.commerce.infrastructure.adapter.out.payment.PaymentProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for payment gateways. Every gateway-backed method is served by the
 * mock provider until real integrations exist.
 */
@Configuration
public class PaymentProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(PaymentProviderConfig.class);

    @Value("${commerce.payments.mock.initiate-delay:300ms}")
    private Duration initiateDelay;

    @Value("${commerce.payments.mock.verify-delay:200ms}")
    private Duration verifyDelay;

    @Value("${commerce.payments.mock.failure-rate:0.05}")
    private double failureRate;

    @Value("${commerce.payments.mock.redirect-base-url:}")
    private String redirectBaseUrl;

    @Bean
    public MockPaymentProvider mockPaymentProvider() {
        return new MockPaymentProvider(initiateDelay, verifyDelay, failureRate, redirectBaseUrl, new SecureRandom());
    }

    @Bean
    public PaymentProviderRegistry paymentProviderRegistry(MockPaymentProvider mockPaymentProvider) {
        Map<PaymentMethod, PaymentProvider> providers = new EnumMap<>(PaymentMethod.class);
        for (PaymentMethod method : PaymentMethod.values()) {
            if (method.requiresProvider()) {
                providers.put(method, mockPaymentProvider);
            }
        }
        log.info("Payment providers registered for {}", providers.keySet());
        return new PaymentProviderRegistry(providers);
    }
}
