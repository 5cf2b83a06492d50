package com.example.commerce.application.dto;

import java.util.List;

public record NotificationPage(List<NotificationView> notifications, PageResult.Pagination pagination,
                               long unreadCount) {
}
