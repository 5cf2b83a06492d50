package com.example.commerce.infrastructure.adapter.in.web;

import com.example.commerce.application.dto.NotificationPage;
import com.example.commerce.application.dto.NotificationView;
import com.example.commerce.application.dto.PageQuery;
import com.example.commerce.application.service.NotificationService;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import com.example.commerce.infrastructure.adapter.in.web.support.Blocking;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@Tag(name = "Notifications", description = "The caller's notification inbox")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Operation(summary = "List notifications", description = "Newest first, with the unread count")
    @GetMapping
    public Mono<ApiEnvelope<NotificationPage>> list(
            Actor actor,
            @RequestParam(defaultValue = "false") boolean unreadOnly,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return Blocking.call(() -> notificationService.list(actor, unreadOnly, PageQuery.of(page, limit)))
                .map(ApiEnvelope::ok);
    }

    @GetMapping("/{notificationId}")
    public Mono<ApiEnvelope<NotificationView>> get(Actor actor, @PathVariable String notificationId) {
        return Blocking.call(() -> notificationService.get(notificationId, actor)).map(ApiEnvelope::ok);
    }

    @PatchMapping("/{notificationId}/read")
    public Mono<ApiEnvelope<NotificationView>> markRead(Actor actor, @PathVariable String notificationId) {
        return Blocking.call(() -> notificationService.markRead(notificationId, actor))
                .map(notification -> ApiEnvelope.ok(notification, "Notification marked as read"));
    }

    @PatchMapping("/read-all")
    public Mono<ApiEnvelope<Map<String, Integer>>> markAllRead(Actor actor) {
        return Blocking.call(() -> notificationService.markAllRead(actor))
                .map(count -> ApiEnvelope.ok(Map.of("updated", count), "All notifications marked as read"));
    }

    @DeleteMapping("/{notificationId}")
    public Mono<ApiEnvelope<Void>> delete(Actor actor, @PathVariable String notificationId) {
        return Blocking.run(() -> notificationService.delete(notificationId, actor))
                .thenReturn(ApiEnvelope.message("Notification deleted"));
    }
}
