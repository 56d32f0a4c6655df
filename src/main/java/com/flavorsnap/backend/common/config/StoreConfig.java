package com.flavorsnap.backend.common.config;

import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.entity.CategoryVoteEntity;
import com.flavorsnap.backend.category.entity.TrainingJobEntity;
import com.flavorsnap.backend.category.repo.CategorySubmissionRepository;
import com.flavorsnap.backend.category.repo.CategoryVoteRepository;
import com.flavorsnap.backend.category.repo.TrainingJobRepository;
import com.flavorsnap.backend.common.storage.StorageProperties;
import com.flavorsnap.backend.common.store.InMemoryRecordStore;
import com.flavorsnap.backend.common.store.JpaRecordStore;
import com.flavorsnap.backend.common.store.RecordKind;
import com.flavorsnap.backend.common.store.RecordStore;
import com.flavorsnap.backend.common.store.StoreProperties;
import com.flavorsnap.backend.common.store.StoredRecord;
import com.flavorsnap.backend.prediction.entity.PredictionEntity;
import com.flavorsnap.backend.prediction.repo.PredictionRepository;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

/**
 * 每個 record kind 一個 RecordStore bean；engine 由 app.store.engine 決定。
 * pipeline 只依賴 RecordStore，不知道底下是 JPA 還是 memory。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({StoreProperties.class, StorageProperties.class})
public class StoreConfig {

    private final StoreProperties props;
    private final EntityManager em;

    public StoreConfig(StoreProperties props, EntityManager em) {
        this.props = props;
        this.em = em;
        log.info("record_store engine={} lockTimeoutMs={}", props.getEngine(), props.getLockTimeout().toMillis());
    }

    @Bean
    public RecordStore<CategorySubmissionEntity> categorySubmissionStore(CategorySubmissionRepository repo) {
        return build(RecordKind.CATEGORY_SUBMISSION, CategorySubmissionEntity.class, repo);
    }

    @Bean
    public RecordStore<CategoryVoteEntity> categoryVoteStore(CategoryVoteRepository repo) {
        return build(RecordKind.CATEGORY_VOTE, CategoryVoteEntity.class, repo);
    }

    @Bean
    public RecordStore<TrainingJobEntity> trainingJobStore(TrainingJobRepository repo) {
        return build(RecordKind.TRAINING_JOB, TrainingJobEntity.class, repo);
    }

    @Bean
    public RecordStore<PredictionEntity> predictionStore(PredictionRepository repo) {
        return build(RecordKind.PREDICTION, PredictionEntity.class, repo);
    }

    private <T extends StoredRecord<T>, R extends JpaRepository<T, String> & JpaSpecificationExecutor<T>> RecordStore<T> build(
            RecordKind kind, Class<T> type, R repo) {
        return switch (props.getEngine()) {
            case JPA -> new JpaRecordStore<>(kind, type, repo, em, props.getLockTimeout());
            case MEMORY -> new InMemoryRecordStore<>(kind, props.getLockTimeout());
        };
    }
}
