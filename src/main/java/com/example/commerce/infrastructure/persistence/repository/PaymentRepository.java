package com.example.commerce.infrastructure.persistence.repository;

import com.example.commerce.infrastructure.persistence.entity.PaymentEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {

    Optional<PaymentEntity> findFirstByTransactionId(String transactionId);

    /**
     * Payments carrying a gateway reference, locked for a callback to settle.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.transactionId = :transactionId ORDER BY p.createdAt ASC")
    List<PaymentEntity> findByTransactionIdForUpdate(@Param("transactionId") String transactionId);

    List<PaymentEntity> findByOrder_IdOrderByCreatedAtDesc(String orderId);
}
