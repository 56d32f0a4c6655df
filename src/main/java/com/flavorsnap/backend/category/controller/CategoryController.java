package com.flavorsnap.backend.category.controller;

import com.flavorsnap.backend.category.dto.*;
import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.entity.TrainingJobEntity;
import com.flavorsnap.backend.category.model.ModerationAction;
import com.flavorsnap.backend.category.model.TrainingStatus;
import com.flavorsnap.backend.category.model.VoteType;
import com.flavorsnap.backend.category.service.CategorySubmissionService;
import com.flavorsnap.backend.category.service.ModerationService;
import com.flavorsnap.backend.category.service.TrainingQueueCoordinator;
import com.flavorsnap.backend.category.service.VoteLedger;
import com.flavorsnap.backend.common.error.ValidationException;
import com.flavorsnap.backend.common.query.PageResult;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Tag(name = "Categories", description = "Community category submission / vote / moderation / training queue")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/categories")
public class CategoryController {

    private final CategorySubmissionService submissionService;
    private final VoteLedger voteLedger;
    private final ModerationService moderationService;
    private final TrainingQueueCoordinator trainingQueue;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public CategorySubmitResponse submitUpload(
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "description", required = false) String description,
            @RequestParam(value = "submittedBy", required = false) String submittedBy,
            @RequestPart(value = "images", required = false) List<MultipartFile> images
    ) {
        return toSubmitResponse(submissionService.submitUpload(name, description, submittedBy, images));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public CategorySubmitResponse submitJson(@RequestBody CategorySubmitRequest body) {
        return toSubmitResponse(submissionService.submit(body));
    }

    @GetMapping
    public CategoryListResponse list(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset,
            @RequestParam(value = "sortBy", required = false) String sortBy,
            @RequestParam(value = "sortDir", required = false) String sortDir,
            @RequestParam(value = "cursor", required = false) String cursor
    ) {
        PageResult<CategoryView> page = submissionService
                .list(status, limit, offset, sortBy, sortDir, cursor)
                .map(CategoryView::of);
        return new CategoryListResponse(page.items(), page.pagination());
    }

    @GetMapping("/popular")
    public List<CategoryView> popular(
            @RequestParam(value = "minVotes", required = false) Integer minVotes,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return submissionService.popular(minVotes, limit).stream().map(CategoryView::of).toList();
    }

    @GetMapping("/stats")
    public CategoryStatsResponse stats() {
        return submissionService.stats();
    }

    @GetMapping("/training/queue")
    public TrainingQueueResponse trainingQueue() {
        List<TrainingQueueItem> items = trainingQueue.listQueued();
        return new TrainingQueueResponse(items, items.size());
    }

    @PutMapping("/training/{jobId}/status")
    public TrainingJobView updateTrainingStatus(@PathVariable String jobId, @RequestBody TrainingStatusRequest body) {
        TrainingStatus status = TrainingStatus.parseOrNull(body == null ? null : body.status());
        if (status == null) {
            throw new ValidationException("INVALID_STATUS", "status must be one of QUEUED, TRAINING, COMPLETED, FAILED");
        }
        TrainingJobEntity job = trainingQueue.updateStatus(jobId, status, body.errorMessage());
        return TrainingJobView.of(job);
    }

    @GetMapping("/{id}")
    public CategoryView getOne(@PathVariable String id) {
        return CategoryView.of(submissionService.get(id));
    }

    @PostMapping("/{id}/vote")
    public VoteResponse vote(@PathVariable String id, @RequestBody VoteRequest body) {
        String raw = body == null ? null : body.voteType();
        VoteType type = VoteType.parseOrNull(raw);
        if (type == null) throw new ValidationException("INVALID_VOTE_TYPE", "voteType must be upvote or downvote");

        VoteLedger.VoteResult r = voteLedger.castVote(id, body.voterId(), type);
        return new VoteResponse(r.categoryId(), r.outcome().name(), r.votesUp(), r.votesDown());
    }

    @PostMapping("/{id}/moderate")
    public ModerationResponse moderate(@PathVariable String id, @RequestBody ModerationRequest body) {
        ModerationAction action = ModerationAction.parseOrNull(body == null ? null : body.action());
        if (action == null) throw new ValidationException("INVALID_ACTION", "action must be approve or reject");

        ModerationService.ModerationResult r = moderationService.moderate(id, body.moderatorId(), action, body.notes());
        return new ModerationResponse(r.categoryId(), r.status().name(), r.trainingJobId());
    }

    private static CategorySubmitResponse toSubmitResponse(CategorySubmissionEntity e) {
        return new CategorySubmitResponse(e.getId(), e.getStatus().name(), String.valueOf(e.getSubmittedAt()));
    }
}
