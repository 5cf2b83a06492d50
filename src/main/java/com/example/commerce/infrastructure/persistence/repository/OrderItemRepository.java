package com.example.commerce.infrastructure.persistence.repository;

import com.example.commerce.infrastructure.persistence.entity.OrderItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OrderItemRepository extends JpaRepository<OrderItemEntity, String> {

    boolean existsByProduct_Id(String productId);
}
