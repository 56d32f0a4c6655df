package com.flavorsnap.backend.category;

import com.flavorsnap.backend.common.store.StoreFilter;
import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.entity.TrainingJobEntity;
import com.flavorsnap.backend.category.model.CategoryStatus;
import com.flavorsnap.backend.category.model.ModerationAction;
import com.flavorsnap.backend.category.model.TrainingStatus;
import com.flavorsnap.backend.category.service.ModerationService;
import com.flavorsnap.backend.common.error.InvalidTransitionException;
import com.flavorsnap.backend.common.error.NotFoundException;
import com.flavorsnap.backend.common.error.StorageUnavailableException;
import com.flavorsnap.backend.common.error.ValidationException;
import com.flavorsnap.backend.common.store.RecordStore;
import com.flavorsnap.backend.testsupport.InMemoryPipeline;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;

class ModerationServiceTest {

    private final InMemoryPipeline p = new InMemoryPipeline();

    @Test
    void approve_creates_exactly_one_queued_job() {
        CategorySubmissionEntity s = p.pending("Jollof Rice");

        ModerationService.ModerationResult r = p.moderation.moderate(s.getId(), "mod-1", ModerationAction.APPROVE, " looks good ");

        assertEquals(CategoryStatus.APPROVED, r.status());
        assertNotNull(r.trainingJobId());

        List<TrainingJobEntity> jobs = p.jobs.scan(StoreFilter.all());
        assertEquals(1, jobs.size());
        TrainingJobEntity job = jobs.get(0);
        assertEquals(r.trainingJobId(), job.getId());
        assertEquals(s.getId(), job.getCategoryId());
        assertEquals(TrainingStatus.QUEUED, job.getStatus());
        assertEquals(p.clock.instant(), job.getCreatedAt());

        CategorySubmissionEntity after = p.submissions.get(s.getId());
        assertEquals("mod-1", after.getModeratedBy());
        assertEquals("looks good", after.getModeratorNotes());
        assertEquals(p.clock.instant(), after.getModeratedAt());
    }

    @Test
    void reject_never_creates_a_job_but_records_moderation() {
        CategorySubmissionEntity s = p.pending("Garri");

        ModerationService.ModerationResult r = p.moderation.moderate(s.getId(), "mod-2", ModerationAction.REJECT, null);

        assertEquals(CategoryStatus.REJECTED, r.status());
        assertNull(r.trainingJobId());
        assertTrue(p.jobs.scan(StoreFilter.all()).isEmpty());

        CategorySubmissionEntity after = p.submissions.get(s.getId());
        assertEquals("mod-2", after.getModeratedBy());
        assertEquals("", after.getModeratorNotes());
        assertNotNull(after.getModeratedAt());
    }

    @Test
    void second_moderation_is_an_invalid_transition() {
        CategorySubmissionEntity s = p.pending("Fufu");
        p.moderation.moderate(s.getId(), "mod-1", ModerationAction.APPROVE, "");

        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> p.moderation.moderate(s.getId(), "mod-1", ModerationAction.REJECT, ""));
        assertEquals("APPROVED", ex.from());
        assertEquals("REJECTED", ex.to());

        assertThrows(InvalidTransitionException.class,
                () -> p.moderation.moderate(s.getId(), "mod-1", ModerationAction.APPROVE, ""));
        assertEquals(1, p.jobs.scan(StoreFilter.all()).size());
    }

    @Test
    void moderator_id_longer_than_column_is_a_validation_error() {
        CategorySubmissionEntity s = p.pending("Ofada Stew");
        String tooLong = "m".repeat(CategorySubmissionEntity.MODERATED_BY_MAX + 1);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> p.moderation.moderate(s.getId(), tooLong, ModerationAction.APPROVE, null));

        assertEquals("MODERATOR_ID_TOO_LONG", ex.code());
        assertEquals(CategoryStatus.PENDING, p.submissions.get(s.getId()).getStatus());
        assertTrue(p.jobs.scan(StoreFilter.all()).isEmpty());
    }

    @Test
    void unknown_submission_is_not_found() {
        assertThrows(NotFoundException.class,
                () -> p.moderation.moderate("missing", "mod-1", ModerationAction.APPROVE, ""));
    }

    @Test
    void missing_moderator_is_rejected() {
        CategorySubmissionEntity s = p.pending("Chin Chin");
        ValidationException ex = assertThrows(ValidationException.class,
                () -> p.moderation.moderate(s.getId(), null, ModerationAction.APPROVE, ""));
        assertEquals("MODERATOR_ID_REQUIRED", ex.code());
    }

    @Test
    @SuppressWarnings("unchecked")
    void failed_job_insert_leaves_submission_pending() {
        RecordStore<TrainingJobEntity> brokenJobs = Mockito.mock(RecordStore.class);
        Mockito.when(brokenJobs.create(any())).thenThrow(new StorageUnavailableException("STORAGE_UNAVAILABLE"));
        ModerationService svc = new ModerationService(p.submissions, brokenJobs, p.telemetry, p.clock);

        CategorySubmissionEntity s = p.pending("Ofada");

        assertThrows(StorageUnavailableException.class,
                () -> svc.moderate(s.getId(), "mod-1", ModerationAction.APPROVE, "ok"));

        CategorySubmissionEntity after = p.submissions.get(s.getId());
        assertEquals(CategoryStatus.PENDING, after.getStatus());
        assertNull(after.getModeratedBy());
        assertNull(after.getModeratedAt());
        assertNull(after.getModeratorNotes());
    }
}
