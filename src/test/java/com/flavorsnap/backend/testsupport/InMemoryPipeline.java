package com.flavorsnap.backend.testsupport;

import com.flavorsnap.backend.category.config.TrainingQueueProperties;
import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.entity.CategoryVoteEntity;
import com.flavorsnap.backend.category.entity.TrainingJobEntity;
import com.flavorsnap.backend.category.model.CategoryStatus;
import com.flavorsnap.backend.category.service.ModerationService;
import com.flavorsnap.backend.category.service.TrainingQueueCoordinator;
import com.flavorsnap.backend.category.service.VoteLedger;
import com.flavorsnap.backend.common.store.InMemoryRecordStore;
import com.flavorsnap.backend.common.store.RecordKind;
import com.flavorsnap.backend.common.telemetry.PipelineTelemetry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 不起 Spring：in-memory stores + 真的 service，直接 new
 */
public class InMemoryPipeline {

    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-15T12:00:00Z"));
    public final PipelineTelemetry telemetry = new PipelineTelemetry();
    public final TrainingQueueProperties trainingProps = new TrainingQueueProperties();

    public final InMemoryRecordStore<CategorySubmissionEntity> submissions =
            new InMemoryRecordStore<>(RecordKind.CATEGORY_SUBMISSION, Duration.ofSeconds(2));
    public final InMemoryRecordStore<CategoryVoteEntity> votes =
            new InMemoryRecordStore<>(RecordKind.CATEGORY_VOTE, Duration.ofSeconds(2));
    public final InMemoryRecordStore<TrainingJobEntity> jobs =
            new InMemoryRecordStore<>(RecordKind.TRAINING_JOB, Duration.ofSeconds(2));

    public final VoteLedger voteLedger = new VoteLedger(submissions, votes, telemetry, clock);
    public final ModerationService moderation = new ModerationService(submissions, jobs, telemetry, clock);
    public final TrainingQueueCoordinator trainingQueue =
            new TrainingQueueCoordinator(jobs, submissions, trainingProps, telemetry, clock);

    public CategorySubmissionEntity pending(String name) {
        CategorySubmissionEntity e = new CategorySubmissionEntity();
        e.setName(name);
        e.setDescription(name + " description");
        e.setSubmittedBy("user-1");
        e.setSubmittedAt(Instant.now(clock));
        e.setStatus(CategoryStatus.PENDING);
        e.setImages(new ArrayList<>(List.of("categories/" + name.replace(' ', '-') + ".jpg")));
        return submissions.create(e);
    }
}
