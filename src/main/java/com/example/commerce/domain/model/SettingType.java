package com.example.commerce.domain.model;

/**
 * Declared type of a persisted setting value. Values are stored as text.
 */
public enum SettingType {
    STRING,
    NUMBER,
    BOOLEAN,
    JSON
}
