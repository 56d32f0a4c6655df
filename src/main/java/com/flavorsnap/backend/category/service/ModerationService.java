package com.flavorsnap.backend.category.service;

import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.entity.TrainingJobEntity;
import com.flavorsnap.backend.category.model.CategoryStatus;
import com.flavorsnap.backend.category.model.ModerationAction;
import com.flavorsnap.backend.common.error.InvalidTransitionException;
import com.flavorsnap.backend.common.error.ValidationException;
import com.flavorsnap.backend.common.store.RecordStore;
import com.flavorsnap.backend.common.telemetry.PipelineTelemetry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PENDING -> APPROVED | REJECTED, exactly once per submission.
 * Approval creates the training job inside the same submission update: both commit or neither does.
 */
@Service
@RequiredArgsConstructor
public class ModerationService {

    private final RecordStore<CategorySubmissionEntity> submissions;
    private final RecordStore<TrainingJobEntity> trainingJobs;
    private final PipelineTelemetry telemetry;
    private final Clock clock;

    public record ModerationResult(String categoryId, CategoryStatus status, String trainingJobId) {}

    public ModerationResult moderate(String submissionId, String moderatorId, ModerationAction action, String notes) {
        String moderator = moderatorId == null ? null : moderatorId.trim();
        if (moderator == null || moderator.isEmpty()) {
            throw new ValidationException("MODERATOR_ID_REQUIRED", "moderatorId is required");
        }
        if (moderator.length() > CategorySubmissionEntity.MODERATED_BY_MAX) {
            throw new ValidationException("MODERATOR_ID_TOO_LONG",
                    "moderatorId must be at most " + CategorySubmissionEntity.MODERATED_BY_MAX + " characters");
        }
        if (action == null) throw new ValidationException("INVALID_ACTION", "action must be approve or reject");
        String cleanNotes = notes == null ? "" : notes.trim();

        AtomicReference<String> jobId = new AtomicReference<>();
        CategorySubmissionEntity after = submissions.update(submissionId, s -> {
            if (s.getStatus() != CategoryStatus.PENDING) {
                throw new InvalidTransitionException("INVALID_TRANSITION", s.getStatus().name(), action.target().name());
            }
            Instant now = Instant.now(clock);

            // ✅ job 先寫：失敗就直接丟出去，submission 維持 PENDING
            if (action == ModerationAction.APPROVE) {
                TrainingJobEntity job = trainingJobs.create(TrainingJobEntity.queued(submissionId, now));
                jobId.set(job.getId());
            }
            s.markModerated(action.target(), moderator, cleanNotes, now);
        });

        telemetry.categoryModerated(after.getId(), moderator, after.getStatus().name());
        if (jobId.get() != null) telemetry.trainingJobEnqueued(jobId.get(), after.getId());
        return new ModerationResult(after.getId(), after.getStatus(), jobId.get());
    }
}
