package com.example.commerce.infrastructure.persistence.repository;

import com.example.commerce.infrastructure.persistence.entity.InventoryMovementEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA Repository for the inventory ledger. Insert and read only.
 */
@Repository
public interface InventoryMovementRepository extends JpaRepository<InventoryMovementEntity, String> {

    Page<InventoryMovementEntity> findByProduct_IdOrderByCreatedAtDesc(String productId, Pageable pageable);

    List<InventoryMovementEntity> findByReferenceId(String referenceId);

    List<InventoryMovementEntity> findByProduct_Id(String productId);
}
