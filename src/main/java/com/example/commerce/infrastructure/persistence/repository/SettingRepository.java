package com.example.commerce.infrastructure.persistence.repository;

import com.example.commerce.infrastructure.persistence.entity.SettingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SettingRepository extends JpaRepository<SettingEntity, String> {

    Optional<SettingEntity> findByKey(String key);

    List<SettingEntity> findByKeyIn(Collection<String> keys);

    List<SettingEntity> findByCategoryOrderByKeyAsc(String category);

    List<SettingEntity> findAllByOrderByKeyAsc();
}
