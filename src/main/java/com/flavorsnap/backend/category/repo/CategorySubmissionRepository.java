package com.flavorsnap.backend.category.repo;

import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface CategorySubmissionRepository extends JpaRepository<CategorySubmissionEntity, String>, JpaSpecificationExecutor<CategorySubmissionEntity> {
}
