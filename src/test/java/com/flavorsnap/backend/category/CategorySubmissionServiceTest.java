package com.flavorsnap.backend.category;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flavorsnap.backend.category.config.CategoryUploadProperties;
import com.flavorsnap.backend.category.dto.CategoryStatsResponse;
import com.flavorsnap.backend.category.dto.CategorySubmitRequest;
import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.model.CategoryStatus;
import com.flavorsnap.backend.category.model.ModerationAction;
import com.flavorsnap.backend.category.model.VoteType;
import com.flavorsnap.backend.category.service.CategorySubmissionService;
import com.flavorsnap.backend.category.validation.CategoryRequestValidator;
import com.flavorsnap.backend.common.error.ValidationException;
import com.flavorsnap.backend.common.image.ImageIntakeService;
import com.flavorsnap.backend.common.query.PageResult;
import com.flavorsnap.backend.common.query.QueryEngine;
import com.flavorsnap.backend.common.storage.LocalDiskStorageService;
import com.flavorsnap.backend.testsupport.InMemoryPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CategorySubmissionServiceTest {

    private final InMemoryPipeline p = new InMemoryPipeline();
    private final CategoryUploadProperties uploadProps = new CategoryUploadProperties();
    private final LocalDiskStorageService storage = new LocalDiskStorageService("./target/test-storage");

    private final CategorySubmissionService service = new CategorySubmissionService(
            p.submissions,
            new CategoryRequestValidator(uploadProps),
            new ImageIntakeService(storage),
            uploadProps,
            p.trainingQueue,
            new QueryEngine(new ObjectMapper()),
            p.telemetry,
            p.clock
    );

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 16, 'J', 'F', 'I', 'F'};

    @Test
    void json_submission_starts_pending_with_zero_votes() {
        CategorySubmissionEntity e = service.submit(
                new CategorySubmitRequest(" Jollof Rice ", "West African rice", "u1", List.of("categories/j.jpg")));

        assertEquals("Jollof Rice", e.getName());
        assertEquals(CategoryStatus.PENDING, e.getStatus());
        assertEquals(0, e.getVotesUp());
        assertEquals(0, e.getVotesDown());
        assertEquals(List.of("categories/j.jpg"), e.getImages());
        assertEquals(p.clock.instant(), e.getSubmittedAt());
        assertNull(e.getModeratedBy());
    }

    @Test
    void json_submission_without_images_is_rejected() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> service.submit(new CategorySubmitRequest("n", "d", "u", List.of())));
        assertEquals("IMAGES_REQUIRED", ex.code());
        assertEquals(0, p.submissions.size());
    }

    @Test
    void upload_skips_non_images_and_stores_the_rest() throws Exception {
        MockMultipartFile img = new MockMultipartFile("images", "a.jpg", "image/jpeg", JPEG);
        MockMultipartFile txt = new MockMultipartFile("images", "notes.txt", "text/plain", "hello".getBytes());

        CategorySubmissionEntity e = service.submitUpload("Suya", "grilled", "u2", List.of(img, txt));

        assertEquals(1, e.getImages().size());
        String key = e.getImages().get(0);
        assertThat(key).startsWith("categories/").endsWith(".jpg");
        assertTrue(storage.exists(key));
        storage.delete(key);
    }

    @Test
    void upload_with_only_non_images_is_rejected_before_storing() {
        MockMultipartFile txt = new MockMultipartFile("images", "notes.txt", "text/plain", "hello".getBytes());
        ValidationException ex = assertThrows(ValidationException.class,
                () -> service.submitUpload("Suya", "grilled", "u2", List.of(txt)));
        assertEquals("IMAGES_REQUIRED", ex.code());
    }

    @Test
    void list_filters_by_status_and_rejects_unknown_status() {
        CategorySubmissionEntity a = p.pending("A");
        p.clock.advance(Duration.ofSeconds(1));
        p.pending("B");
        p.moderation.moderate(a.getId(), "mod", ModerationAction.REJECT, "");

        PageResult<CategorySubmissionEntity> pending = service.list("pending", null, null, null, null, null);
        assertThat(pending.items()).extracting(CategorySubmissionEntity::getName).containsExactly("B");
        assertEquals(50, pending.pagination().limit());

        PageResult<CategorySubmissionEntity> all = service.list(null, null, null, null, null, null);
        assertThat(all.items()).extracting(CategorySubmissionEntity::getName).containsExactly("B", "A");

        ValidationException ex = assertThrows(ValidationException.class,
                () -> service.list("archived", null, null, null, null, null));
        assertEquals("INVALID_STATUS", ex.code());
    }

    @Test
    void popular_orders_by_net_then_upvotes_and_only_pending() {
        CategorySubmissionEntity x = p.pending("X");
        CategorySubmissionEntity y = p.pending("Y");
        CategorySubmissionEntity z = p.pending("Z");
        CategorySubmissionEntity closed = p.pending("Closed");

        vote(x, 3, 1);  // net 2, up 3
        vote(y, 2, 0);  // net 2, up 2
        vote(z, 5, 0);  // net 5
        vote(closed, 9, 0);
        p.moderation.moderate(closed.getId(), "mod", ModerationAction.APPROVE, "");

        List<CategorySubmissionEntity> top = service.popular(2, null);
        assertThat(top).extracting(CategorySubmissionEntity::getName).containsExactly("Z", "X", "Y");

        // minVotes 會被夾到 >= 1，limit 夾到 1..50
        assertThat(service.popular(-3, 1)).hasSize(1);
        assertThat(service.popular(4, 500)).extracting(CategorySubmissionEntity::getName).containsExactly("Z", "X");
    }

    @Test
    void stats_reports_status_totals_votes_and_queue() {
        CategorySubmissionEntity a = p.pending("A");
        p.pending("B");
        vote(a, 2, 1);
        p.moderation.moderate(a.getId(), "mod", ModerationAction.APPROVE, "");

        CategoryStatsResponse s = service.stats();

        assertEquals(2, s.totalCategories());
        assertEquals(1L, s.byStatus().get("PENDING"));
        assertEquals(1L, s.byStatus().get("APPROVED"));
        assertEquals(0L, s.byStatus().get("IN_TRAINING"));
        assertEquals(2, s.totalUpvotes());
        assertEquals(1, s.totalDownvotes());
        assertEquals(1, s.trainingQueueSize());
        assertEquals(1L, s.trainingJobs().get("QUEUED"));
    }

    private void vote(CategorySubmissionEntity s, int up, int down) {
        for (int i = 0; i < up; i++) p.voteLedger.castVote(s.getId(), s.getName() + "-up-" + i, VoteType.UPVOTE);
        for (int i = 0; i < down; i++) p.voteLedger.castVote(s.getId(), s.getName() + "-down-" + i, VoteType.DOWNVOTE);
    }
}
