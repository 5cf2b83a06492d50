package com.example.commerce.application.service;

import com.example.commerce.application.dto.PaymentMethodOption;
import com.example.commerce.application.dto.SettingView;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.model.Money;
import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PricingPolicy;
import com.example.commerce.domain.model.SettingType;
import com.example.commerce.infrastructure.persistence.entity.SettingEntity;
import com.example.commerce.infrastructure.persistence.repository.SettingRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed key/value store settings, including the pricing rules read at checkout.
 */
@Service
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    public static final String TAX_RATE = "tax_rate";
    public static final String FREE_SHIPPING_THRESHOLD = "free_shipping_threshold";
    public static final String SHIPPING_COST = "shipping_cost";
    public static final String PAYMENT_METHODS = "payment_methods";

    private static final List<PaymentMethodOption> DEFAULT_PAYMENT_METHODS = List.of(
            new PaymentMethodOption(PaymentMethod.CHAPA, "Chapa", true),
            new PaymentMethodOption(PaymentMethod.TELEBIRR, "Telebirr", true),
            new PaymentMethodOption(PaymentMethod.SANTIM_PAY, "Santim Pay", true),
            new PaymentMethodOption(PaymentMethod.CASH_ON_DELIVERY, "Cash on Delivery", true),
            new PaymentMethodOption(PaymentMethod.BANK_TRANSFER, "Bank Transfer", true));

    private final SettingRepository settingRepository;
    private final ObjectMapper objectMapper;
    private final String currency;
    private final BigDecimal defaultTaxRate;
    private final BigDecimal defaultFreeShippingThreshold;
    private final BigDecimal defaultShippingCost;

    public SettingsService(
            SettingRepository settingRepository,
            ObjectMapper objectMapper,
            @Value("${commerce.currency:ETB}") String currency,
            @Value("${commerce.pricing.tax-rate:0.15}") BigDecimal defaultTaxRate,
            @Value("${commerce.pricing.free-shipping-threshold:500}") BigDecimal defaultFreeShippingThreshold,
            @Value("${commerce.pricing.shipping-cost:25}") BigDecimal defaultShippingCost) {
        this.settingRepository = settingRepository;
        this.objectMapper = objectMapper;
        this.currency = currency;
        this.defaultTaxRate = defaultTaxRate;
        this.defaultFreeShippingThreshold = defaultFreeShippingThreshold;
        this.defaultShippingCost = defaultShippingCost;
    }

    /**
     * Pricing rules from persisted settings, falling back to configured defaults.
     */
    @Transactional(readOnly = true)
    public PricingPolicy pricingPolicy() {
        Map<String, SettingEntity> rows = new LinkedHashMap<>();
        settingRepository.findByKeyIn(List.of(TAX_RATE, FREE_SHIPPING_THRESHOLD, SHIPPING_COST))
                .forEach(row -> rows.put(row.getKey(), row));

        return new PricingPolicy(
                decimalSetting(rows.get(TAX_RATE), defaultTaxRate),
                Money.of(decimalSetting(rows.get(FREE_SHIPPING_THRESHOLD), defaultFreeShippingThreshold), currency),
                Money.of(decimalSetting(rows.get(SHIPPING_COST), defaultShippingCost), currency));
    }

    public String currency() {
        return currency;
    }

    @Transactional(readOnly = true)
    public List<PaymentMethodOption> paymentMethods() {
        return settingRepository.findByKey(PAYMENT_METHODS)
                .flatMap(this::parsePaymentMethods)
                .filter(list -> !list.isEmpty())
                .orElse(DEFAULT_PAYMENT_METHODS);
    }

    /**
     * All settings, optionally restricted to one category, as a key to typed value map.
     */
    @Transactional(readOnly = true)
    public Map<String, Object> getAll(String category) {
        List<SettingEntity> rows = category == null || category.isBlank()
                ? settingRepository.findAllByOrderByKeyAsc()
                : settingRepository.findByCategoryOrderByKeyAsc(category);

        Map<String, Object> values = new LinkedHashMap<>();
        rows.forEach(row -> values.put(row.getKey(), typedValue(row)));
        return values;
    }

    @Transactional(readOnly = true)
    public SettingView get(String key) {
        SettingEntity row = settingRepository.findByKey(key)
                .orElseThrow(() -> new NotFoundException("Setting", key));
        return new SettingView(row.getKey(), typedValue(row), row.getType(), row.getCategory());
    }

    /**
     * Public look-and-feel settings with defaults for anything not configured.
     */
    @Transactional(readOnly = true)
    public Map<String, Object> uiSettings() {
        Map<String, Object> stored = getAll(SettingCategories.UI);
        Map<String, Object> ui = new LinkedHashMap<>();
        ui.put("ui_theme", stored.getOrDefault("ui_theme", Map.of("primary", "#03A688", "accent", "#F2EDD5")));
        ui.put("ui_modules", stored.getOrDefault("ui_modules", List.of()));
        ui.put("ui_home_layout", stored.getOrDefault("ui_home_layout", Map.of()));
        ui.put("ui_category_layout", stored.getOrDefault("ui_category_layout", "chips"));
        return ui;
    }

    /**
     * Creates or replaces each given setting, inferring its type from the JSON value.
     *
     * @return the stored values after the update
     */
    @Transactional
    public Map<String, Object> upsert(Map<String, Object> values) {
        Map<String, Object> updated = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Setting key cannot be blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("Setting " + key + " cannot be null");
            }
            SettingType type = inferType(value);
            SettingEntity row = settingRepository.findByKey(key).orElseGet(() -> new SettingEntity(key));
            row.assign(serialize(value, type), type, SettingCategories.forKey(key));
            settingRepository.save(row);
            updated.put(key, typedValue(row));
        });
        log.info("Updated {} setting(s): {}", updated.size(), updated.keySet());
        return updated;
    }

    private SettingType inferType(Object value) {
        if (value instanceof Map || value instanceof List) {
            return SettingType.JSON;
        }
        if (value instanceof Number) {
            return SettingType.NUMBER;
        }
        if (value instanceof Boolean) {
            return SettingType.BOOLEAN;
        }
        return SettingType.STRING;
    }

    private String serialize(Object value, SettingType type) {
        if (type != SettingType.JSON) {
            return String.valueOf(value);
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Setting value is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Object typedValue(SettingEntity row) {
        String raw = row.getValue();
        try {
            return switch (row.getType()) {
                case NUMBER -> new BigDecimal(raw);
                case BOOLEAN -> Boolean.parseBoolean(raw);
                case JSON -> objectMapper.readValue(raw, Object.class);
                case STRING -> raw;
            };
        } catch (NumberFormatException | JsonProcessingException e) {
            log.warn("Setting {} is not a valid {} value, returning raw text", row.getKey(), row.getType());
            return raw;
        }
    }

    private BigDecimal decimalSetting(SettingEntity row, BigDecimal fallback) {
        if (row == null) {
            return fallback;
        }
        try {
            return new BigDecimal(row.getValue().trim());
        } catch (NumberFormatException e) {
            log.warn("Setting {} has non-numeric value '{}', using default {}", row.getKey(), row.getValue(), fallback);
            return fallback;
        }
    }

    private Optional<List<PaymentMethodOption>> parsePaymentMethods(SettingEntity row) {
        try {
            return Optional.of(objectMapper.readValue(row.getValue(), new TypeReference<List<PaymentMethodOption>>() {
            }));
        } catch (JsonProcessingException e) {
            log.warn("Setting {} could not be parsed, using default payment methods: {}",
                    PAYMENT_METHODS, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Category assignment for setting keys.
     */
    static final class SettingCategories {

        static final String GENERAL = "general";
        static final String PAYMENT = "payment";
        static final String UI = "ui";

        private SettingCategories() {
        }

        static String forKey(String key) {
            if (PAYMENT_METHODS.equals(key)) {
                return PAYMENT;
            }
            if (key.startsWith("ui_")) {
                return UI;
            }
            return GENERAL;
        }
    }
}
