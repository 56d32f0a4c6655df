package com.flavorsnap.backend.category;

import com.flavorsnap.backend.category.dto.TrainingQueueItem;
import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.entity.TrainingJobEntity;
import com.flavorsnap.backend.category.model.ModerationAction;
import com.flavorsnap.backend.category.model.TrainingStatus;
import com.flavorsnap.backend.common.error.InvalidTransitionException;
import com.flavorsnap.backend.common.error.NotFoundException;
import com.flavorsnap.backend.category.service.TrainingQueueCoordinator;
import com.flavorsnap.backend.common.store.InMemoryRecordStore;
import com.flavorsnap.backend.testsupport.InMemoryPipeline;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TrainingQueueCoordinatorTest {

    private final InMemoryPipeline p = new InMemoryPipeline();

    private String approve(String name) {
        CategorySubmissionEntity s = p.pending(name);
        String jobId = p.moderation.moderate(s.getId(), "mod", ModerationAction.APPROVE, "").trainingJobId();
        p.clock.advance(Duration.ofSeconds(1));
        return jobId;
    }

    @Test
    void queue_is_fifo_and_joined_with_category() {
        String first = approve("Akara");
        String second = approve("Bread");
        String third = approve("Egusi");
        p.trainingQueue.updateStatus(second, TrainingStatus.TRAINING, null);
        p.trainingQueue.updateStatus(third, TrainingStatus.COMPLETED, null);

        List<TrainingQueueItem> q = p.trainingQueue.listQueued();

        assertThat(q).extracting(TrainingQueueItem::jobId).containsExactly(first, second);
        assertEquals("Akara", q.get(0).name());
        assertEquals("Akara description", q.get(0).description());
        assertThat(q.get(0).images()).hasSize(1);
        assertEquals("TRAINING", q.get(1).status());
    }

    @Test
    void queue_loads_categories_in_one_batch() {
        approve("Akara");
        approve("Bread");
        approve("Egusi");

        InMemoryRecordStore<CategorySubmissionEntity> submissions = Mockito.spy(p.submissions);
        TrainingQueueCoordinator coordinator =
                new TrainingQueueCoordinator(p.jobs, submissions, p.trainingProps, p.telemetry, p.clock);

        List<TrainingQueueItem> q = coordinator.listQueued();

        assertThat(q).extracting(TrainingQueueItem::name).containsExactly("Akara", "Bread", "Egusi");
        Mockito.verify(submissions, Mockito.times(1)).findAll(ArgumentMatchers.anyCollection());
        Mockito.verify(submissions, Mockito.never()).find(ArgumentMatchers.any());
    }

    @Test
    void started_and_completed_are_set_once() {
        String id = approve("Yam");
        Instant t1 = p.clock.instant();

        p.trainingQueue.updateStatus(id, TrainingStatus.TRAINING, null);
        p.clock.advance(Duration.ofMinutes(5));
        p.trainingQueue.updateStatus(id, TrainingStatus.TRAINING, null); // 重複回報

        TrainingJobEntity j = p.jobs.get(id);
        assertEquals(t1, j.getStartedAt());

        Instant t2 = p.clock.instant();
        p.trainingQueue.updateStatus(id, TrainingStatus.COMPLETED, null);
        p.clock.advance(Duration.ofMinutes(5));
        p.trainingQueue.updateStatus(id, TrainingStatus.COMPLETED, null);

        j = p.jobs.get(id);
        assertEquals(t2, j.getCompletedAt());
        assertNull(j.getErrorMessage());
    }

    @Test
    void failed_records_error_and_later_status_clears_it() {
        String id = approve("Moi Moi");

        TrainingJobEntity failed = p.trainingQueue.updateStatus(id, TrainingStatus.FAILED, " GPU OOM ");
        assertEquals("GPU OOM", failed.getErrorMessage());
        assertNotNull(failed.getCompletedAt());

        // 非 strict：worker 重試直接回報 TRAINING
        TrainingJobEntity retried = p.trainingQueue.updateStatus(id, TrainingStatus.TRAINING, "ignored");
        assertNull(retried.getErrorMessage());
        assertEquals(TrainingStatus.TRAINING, retried.getStatus());
    }

    @Test
    void unknown_job_is_not_found() {
        NotFoundException ex = assertThrows(NotFoundException.class,
                () -> p.trainingQueue.updateStatus("nope", TrainingStatus.TRAINING, null));
        assertEquals("TRAINING_JOB_NOT_FOUND", ex.code());
    }

    @Test
    void strict_mode_rejects_backwards_moves() {
        p.trainingProps.setStrictTransitions(true);
        String id = approve("Rice and Stew");

        p.trainingQueue.updateStatus(id, TrainingStatus.TRAINING, null);
        p.trainingQueue.updateStatus(id, TrainingStatus.COMPLETED, null);

        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> p.trainingQueue.updateStatus(id, TrainingStatus.TRAINING, null));
        assertEquals("INVALID_TRAINING_TRANSITION", ex.code());
        assertEquals(TrainingStatus.COMPLETED, p.jobs.get(id).getStatus());

        // 同狀態重送 OK
        p.trainingQueue.updateStatus(id, TrainingStatus.COMPLETED, null);
    }

    @Test
    void lax_mode_accepts_any_sequence() {
        String id = approve("Bread");
        p.trainingQueue.updateStatus(id, TrainingStatus.COMPLETED, null);
        TrainingJobEntity j = p.trainingQueue.updateStatus(id, TrainingStatus.QUEUED, null);
        assertEquals(TrainingStatus.QUEUED, j.getStatus());
    }

    @Test
    void summary_counts_every_status() {
        approve("A1");
        String b = approve("B1");
        p.trainingQueue.updateStatus(b, TrainingStatus.FAILED, "boom");

        var counts = p.trainingQueue.summary();
        assertEquals(1L, counts.get(TrainingStatus.QUEUED));
        assertEquals(0L, counts.get(TrainingStatus.TRAINING));
        assertEquals(0L, counts.get(TrainingStatus.COMPLETED));
        assertEquals(1L, counts.get(TrainingStatus.FAILED));
    }
}
