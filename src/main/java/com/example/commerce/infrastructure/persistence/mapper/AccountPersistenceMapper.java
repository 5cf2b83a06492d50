package com.example.commerce.infrastructure.persistence.mapper;

import com.example.commerce.application.dto.NotificationView;
import com.example.commerce.application.dto.UserView;
import com.example.commerce.infrastructure.persistence.entity.NotificationEntity;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import org.springframework.stereotype.Component;

@Component
public class AccountPersistenceMapper {

    public UserView toView(UserEntity user) {
        return new UserView(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getPhone(),
                user.getRole(),
                user.getStatus(),
                user.getAddress(),
                user.getCity(),
                user.getCountry(),
                user.getPostalCode(),
                user.getTotalOrders(),
                user.getTotalSpent(),
                user.getCreatedAt()
        );
    }

    public NotificationView toView(NotificationEntity notification) {
        return new NotificationView(
                notification.getId(),
                notification.getType(),
                notification.getTitle(),
                notification.getMessage(),
                notification.getLink(),
                notification.isRead(),
                notification.getReadAt(),
                notification.getCreatedAt()
        );
    }
}
