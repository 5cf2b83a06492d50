package com.example.commerce.application.dto;

import com.example.commerce.domain.model.SettingType;

/**
 * A setting with its value converted to the declared type.
 */
public record SettingView(String key, Object value, SettingType type, String category) {
}
