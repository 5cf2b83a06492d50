package com.example.commerce.application.dto;

import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;

public record UserQuery(String search, Role role, UserStatus status, PageQuery page) {
}
