package com.example.commerce.infrastructure.persistence.repository;

import com.example.commerce.infrastructure.persistence.entity.CategoryEntity;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CategoryRepository extends JpaRepository<CategoryEntity, String> {

    List<CategoryEntity> findByActiveTrue(Sort sort);

    boolean existsBySlug(String slug);

    boolean existsByParent_Id(String parentId);
}
