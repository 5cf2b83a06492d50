package com.example.commerce.infrastructure.persistence.mapper;

import com.example.commerce.application.dto.PaymentView;
import com.example.commerce.infrastructure.persistence.entity.PaymentEntity;
import org.springframework.stereotype.Component;

@Component
public class PaymentPersistenceMapper {

    public PaymentView toView(PaymentEntity payment) {
        return new PaymentView(
                payment.getId(),
                payment.getOrder().getId(),
                payment.getOrder().getOrderNumber(),
                payment.getAmount(),
                payment.getMethod(),
                payment.getStatus(),
                payment.getTransactionId(),
                payment.getFailureReason(),
                payment.getProcessedAt(),
                payment.getCreatedAt()
        );
    }
}
