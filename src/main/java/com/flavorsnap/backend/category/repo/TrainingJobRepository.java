package com.flavorsnap.backend.category.repo;

import com.flavorsnap.backend.category.entity.TrainingJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface TrainingJobRepository extends JpaRepository<TrainingJobEntity, String>, JpaSpecificationExecutor<TrainingJobEntity> {
}
