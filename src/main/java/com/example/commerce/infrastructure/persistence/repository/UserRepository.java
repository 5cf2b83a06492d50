package com.example.commerce.infrastructure.persistence.repository;

import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * JPA Repository for UserEntity.
 */
@Repository
public interface UserRepository extends JpaRepository<UserEntity, String>, JpaSpecificationExecutor<UserEntity> {

    List<UserEntity> findByRoleInAndStatus(Collection<Role> roles, UserStatus status);

    boolean existsByEmailIgnoreCase(String email);

    long countByStatusAndRole(UserStatus status, Role role);

    long countByRoleAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(Role role, Instant from, Instant to);
}
