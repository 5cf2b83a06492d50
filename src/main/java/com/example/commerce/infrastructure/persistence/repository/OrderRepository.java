package com.example.commerce.infrastructure.persistence.repository;

import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentStatus;
import com.example.commerce.infrastructure.persistence.entity.OrderEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA Repository for OrderEntity.
 */
@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, String>, JpaSpecificationExecutor<OrderEntity> {

    @EntityGraph(attributePaths = "items")
    @Query("SELECT o FROM OrderEntity o WHERE o.id = :id")
    Optional<OrderEntity> findWithItemsById(@Param("id") String id);

    /**
     * Loads an order under a row lock. Every status, cancellation and payment write
     * goes through here, so concurrent writers on one order run one after another.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OrderEntity o WHERE o.id = :id")
    Optional<OrderEntity> findByIdForUpdate(@Param("id") String id);

    boolean existsByUser_Id(String userId);

    long countByOrderStatus(OrderStatus orderStatus);

    long countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(Instant from, Instant to);

    long countByPaymentStatusAndCreatedAtGreaterThanEqual(PaymentStatus paymentStatus, Instant from);

    @Query("SELECT COALESCE(SUM(o.total), 0) FROM OrderEntity o WHERE o.paymentStatus = :status")
    BigDecimal sumTotalByPaymentStatus(@Param("status") PaymentStatus status);

    @Query("""
            SELECT COALESCE(SUM(o.total), 0) FROM OrderEntity o
            WHERE o.paymentStatus = :status AND o.createdAt >= :from AND o.createdAt < :to
            """)
    BigDecimal sumTotalByPaymentStatusBetween(@Param("status") PaymentStatus status,
                                              @Param("from") Instant from,
                                              @Param("to") Instant to);

    List<OrderEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
