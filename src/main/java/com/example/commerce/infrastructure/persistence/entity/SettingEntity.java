package com.example.commerce.infrastructure.persistence.entity;

import com.example.commerce.domain.model.SettingType;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA Entity for a store setting. Values are stored as text with a declared type.
 */
@Entity
@Table(name = "settings")
public class SettingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "setting_key", nullable = false, unique = true, length = 100)
    private String key;

    @Column(name = "setting_value", nullable = false, length = 4000)
    private String value;

    @Column(name = "type", nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private SettingType type;

    @Column(name = "category", nullable = false, length = 32)
    private String category;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected SettingEntity() {
    }

    public SettingEntity(String key) {
        this.key = key;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }

    public void assign(String value, SettingType type, String category) {
        this.value = value;
        this.type = type;
        this.category = category;
    }

    public String getId() {
        return id;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public SettingType getType() {
        return type;
    }

    public String getCategory() {
        return category;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
