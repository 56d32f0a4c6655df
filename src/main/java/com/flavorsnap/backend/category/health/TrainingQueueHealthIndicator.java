package com.flavorsnap.backend.category.health;

import com.flavorsnap.backend.category.config.TrainingQueueProperties;
import com.flavorsnap.backend.category.model.TrainingStatus;
import com.flavorsnap.backend.category.service.TrainingQueueCoordinator;
import com.flavorsnap.backend.common.error.StorageUnavailableException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.EnumMap;

/**
 * ✅ readiness：
 * - store 讀得到 -> UP（附 queue 深度）
 * - store 讀不到 -> DOWN
 * backlog 太多只是 detail，不讓 pod 被踢掉
 */
@Component
public class TrainingQueueHealthIndicator implements HealthIndicator {

    private final TrainingQueueCoordinator coordinator;
    private final TrainingQueueProperties props;

    public TrainingQueueHealthIndicator(TrainingQueueCoordinator coordinator, TrainingQueueProperties props) {
        this.coordinator = coordinator;
        this.props = props;
    }

    @Override
    public Health health() {
        EnumMap<TrainingStatus, Long> counts;
        try {
            counts = coordinator.summary();
        } catch (StorageUnavailableException e) {
            return Health.down()
                    .withDetail("reason", e.code())
                    .build();
        }

        long queued = counts.get(TrainingStatus.QUEUED);
        long training = counts.get(TrainingStatus.TRAINING);
        return Health.up()
                .withDetail("queued", queued)
                .withDetail("training", training)
                .withDetail("failed", counts.get(TrainingStatus.FAILED))
                .withDetail("backlog", queued > props.getBacklogWarnThreshold())
                .withDetail("strictTransitions", props.isStrictTransitions())
                .build();
    }
}
