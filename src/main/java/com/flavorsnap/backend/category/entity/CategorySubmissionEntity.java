package com.flavorsnap.backend.category.entity;

import com.flavorsnap.backend.category.model.CategoryStatus;
import com.flavorsnap.backend.common.store.StoredRecord;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "category_submissions",
        indexes = @Index(name = "idx_category_submissions_status", columnList = "status,submitted_at_utc")
)
public class CategorySubmissionEntity implements StoredRecord<CategorySubmissionEntity> {

    public static final int MODERATED_BY_MAX = 128;

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(length = 100, nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String description;

    @Column(name = "submitted_by", length = 128, nullable = false)
    private String submittedBy;

    @Column(name = "submitted_at_utc", nullable = false)
    private Instant submittedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private CategoryStatus status;

    /** object keys（由 StorageService 產生），順序即上傳順序 */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "images_json", nullable = false)
    private List<String> images = new ArrayList<>();

    @Column(name = "votes_up", nullable = false)
    private int votesUp = 0;

    @Column(name = "votes_down", nullable = false)
    private int votesDown = 0;

    @Column(name = "moderator_notes", columnDefinition = "TEXT")
    private String moderatorNotes;

    // approve / reject 都會寫
    @Column(name = "moderated_by", length = MODERATED_BY_MAX)
    private String moderatedBy;

    @Column(name = "moderated_at_utc")
    private Instant moderatedAt;

    @PrePersist
    void prePersist() {
        if (status == null) status = CategoryStatus.PENDING;
        if (submittedAt == null) submittedAt = Instant.now();
    }

    public int netVotes() {
        return votesUp - votesDown;
    }

    public int totalVotes() {
        return votesUp + votesDown;
    }

    /** 三個欄位永遠一起寫 */
    public void markModerated(CategoryStatus next, String moderatorId, String notes, Instant now) {
        this.status = next;
        this.moderatedBy = moderatorId;
        this.moderatorNotes = notes;
        this.moderatedAt = now;
    }

    @Override
    public CategorySubmissionEntity copy() {
        CategorySubmissionEntity c = new CategorySubmissionEntity();
        c.id = id;
        c.name = name;
        c.description = description;
        c.submittedBy = submittedBy;
        c.submittedAt = submittedAt;
        c.status = status;
        c.images = images == null ? new ArrayList<>() : new ArrayList<>(images);
        c.votesUp = votesUp;
        c.votesDown = votesDown;
        c.moderatorNotes = moderatorNotes;
        c.moderatedBy = moderatedBy;
        c.moderatedAt = moderatedAt;
        return c;
    }
}
