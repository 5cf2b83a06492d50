package com.example.commerce.infrastructure.adapter.in.web;

import com.example.commerce.application.dto.SettingView;
import com.example.commerce.application.service.SettingsService;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.Role;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import com.example.commerce.infrastructure.adapter.in.web.support.Blocking;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/settings")
@Tag(name = "Settings", description = "Store settings, including pricing and payment methods")
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Operation(summary = "Storefront look-and-feel settings", description = "Public, with defaults")
    @GetMapping("/ui")
    public Mono<ApiEnvelope<Map<String, Object>>> uiSettings() {
        return Blocking.call(settingsService::uiSettings).map(ApiEnvelope::ok);
    }

    @Operation(summary = "All settings as typed values", description = "ADMIN or MANAGER")
    @GetMapping
    public Mono<ApiEnvelope<Map<String, Object>>> getAll(Actor actor,
                                                         @RequestParam(required = false) String category) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(() -> settingsService.getAll(category)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "One setting", description = "ADMIN or MANAGER")
    @GetMapping("/{key}")
    public Mono<ApiEnvelope<SettingView>> get(Actor actor, @PathVariable String key) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(() -> settingsService.get(key)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Create or replace settings", description = "ADMIN. Body is a JSON object of key to value")
    @PatchMapping
    public Mono<ApiEnvelope<Map<String, Object>>> update(Actor actor, @RequestBody Map<String, Object> values) {
        actor.requireAnyRole(Role.ADMIN);
        return Blocking.call(() -> settingsService.upsert(values))
                .map(updated -> ApiEnvelope.ok(updated, "Settings updated successfully"));
    }
}
