package com.example.commerce.infrastructure.adapter.in.web.dto;

/**
 * Validation group for constraints that only apply when a resource is created.
 * Update endpoints validate the default group alone, so omitted fields pass.
 */
public interface OnCreate {
}
