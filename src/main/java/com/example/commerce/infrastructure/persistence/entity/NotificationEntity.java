package com.example.commerce.infrastructure.persistence.entity;

import com.example.commerce.domain.model.NotificationType;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA Entity for a user's in-app notification.
 */
@Entity
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notification_user", columnList = "user_id, is_read")
})
public class NotificationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "type", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private NotificationType type;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, length = 1000)
    private String message;

    @Column(name = "link", length = 500)
    private String link;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "created_at")
    private Instant createdAt;

    protected NotificationEntity() {
    }

    public static NotificationEntity of(String userId, NotificationType type, String title,
                                        String message, String link) {
        NotificationEntity notification = new NotificationEntity();
        notification.userId = userId;
        notification.type = type;
        notification.title = title;
        notification.message = message;
        notification.link = link;
        return notification;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public void markRead() {
        if (!read) {
            this.read = true;
            this.readAt = Instant.now();
        }
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public NotificationType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public String getLink() {
        return link;
    }

    public boolean isRead() {
        return read;
    }

    public Instant getReadAt() {
        return readAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
