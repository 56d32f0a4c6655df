package com.flavorsnap.backend.category.service;

import com.flavorsnap.backend.category.config.TrainingQueueProperties;
import com.flavorsnap.backend.category.dto.TrainingQueueItem;
import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.entity.TrainingJobEntity;
import com.flavorsnap.backend.category.model.TrainingStatus;
import com.flavorsnap.backend.common.error.InvalidTransitionException;
import com.flavorsnap.backend.common.error.ValidationException;
import com.flavorsnap.backend.common.store.RecordStore;
import com.flavorsnap.backend.common.store.StoreFilter;
import com.flavorsnap.backend.common.telemetry.PipelineTelemetry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polled by the external training worker: FIFO listing plus status reports.
 */
@Service
@RequiredArgsConstructor
public class TrainingQueueCoordinator {

    static final Comparator<TrainingJobEntity> FIFO = Comparator
            .comparing(TrainingJobEntity::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TrainingJobEntity::getId);

    private final RecordStore<TrainingJobEntity> trainingJobs;
    private final RecordStore<CategorySubmissionEntity> submissions;
    private final TrainingQueueProperties props;
    private final PipelineTelemetry telemetry;
    private final Clock clock;

    public List<TrainingQueueItem> listQueued() {
        List<TrainingJobEntity> live = trainingJobs.scan(liveJobs()).stream()
                .sorted(FIFO)
                .toList();
        if (live.isEmpty()) return List.of();

        // ✅ 一次撈回所有 category，不要每個 job 各查一次
        Map<String, CategorySubmissionEntity> categories = new HashMap<>();
        for (CategorySubmissionEntity c : submissions.findAll(live.stream().map(TrainingJobEntity::getCategoryId).toList())) {
            categories.put(c.getId(), c);
        }
        return live.stream()
                .map(j -> toItem(j, Optional.ofNullable(categories.get(j.getCategoryId()))))
                .toList();
    }

    private static StoreFilter<TrainingJobEntity> liveJobs() {
        return StoreFilter.<TrainingJobEntity>all().in("status", TrainingJobEntity::getStatus, TrainingStatus.LIVE);
    }

    private static TrainingQueueItem toItem(TrainingJobEntity j, Optional<CategorySubmissionEntity> c) {
        return new TrainingQueueItem(
                j.getId(),
                j.getCategoryId(),
                j.getStatus().name(),
                j.getCreatedAt(),
                j.getStartedAt(),
                c.map(CategorySubmissionEntity::getName).orElse(null),
                c.map(CategorySubmissionEntity::getDescription).orElse(null),
                c.map(s -> List.copyOf(s.getImages())).orElse(List.of())
        );
    }

    public TrainingJobEntity updateStatus(String jobId, TrainingStatus next, String errorMessage) {
        if (next == null) {
            throw new ValidationException("INVALID_STATUS", "status must be one of QUEUED, TRAINING, COMPLETED, FAILED");
        }
        AtomicReference<TrainingStatus> previous = new AtomicReference<>();
        TrainingJobEntity after = trainingJobs.update(jobId, j -> {
            previous.set(j.getStatus());
            if (props.isStrictTransitions() && !j.getStatus().canMoveTo(next)) {
                throw new InvalidTransitionException("INVALID_TRAINING_TRANSITION", j.getStatus().name(), next.name());
            }
            j.applyStatus(next, errorMessage, Instant.now(clock));
        });

        telemetry.trainingStatusUpdated(after.getId(), previous.get().name(), after.getStatus().name(), after.getErrorMessage());
        return after;
    }

    /** 每個狀態都有 key（沒有就是 0） */
    public EnumMap<TrainingStatus, Long> summary() {
        EnumMap<TrainingStatus, Long> counts = new EnumMap<>(TrainingStatus.class);
        StoreFilter<TrainingJobEntity> all = StoreFilter.all();
        for (TrainingStatus s : TrainingStatus.values()) {
            counts.put(s, trainingJobs.count(all.in("status", TrainingJobEntity::getStatus, List.of(s))));
        }
        return counts;
    }
}
