package com.flavorsnap.backend.category.repo;

import com.flavorsnap.backend.category.entity.CategoryVoteEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface CategoryVoteRepository extends JpaRepository<CategoryVoteEntity, String>, JpaSpecificationExecutor<CategoryVoteEntity> {
}
