package com.flavorsnap.backend.prediction.repo;

import com.flavorsnap.backend.prediction.entity.PredictionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface PredictionRepository extends JpaRepository<PredictionEntity, String>, JpaSpecificationExecutor<PredictionEntity> {
}
