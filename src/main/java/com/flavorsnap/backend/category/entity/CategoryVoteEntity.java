package com.flavorsnap.backend.category.entity;

import com.flavorsnap.backend.category.model.VoteType;
import com.flavorsnap.backend.common.store.StoredRecord;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 一個 voter 對一個 submission 最多一筆；id = submissionId:voterId，所以查詢就是 PK lookup。
 * 永遠不刪除。
 */
@Getter
@Setter
@Entity
@Table(name = "category_votes",
        uniqueConstraints = @UniqueConstraint(name = "ux_category_votes_submission_voter",
                columnNames = {"submission_id", "voter_id"}),
        indexes = @Index(name = "idx_category_votes_submission", columnList = "submission_id")
)
public class CategoryVoteEntity implements StoredRecord<CategoryVoteEntity> {

    public static final int VOTER_ID_MAX = 128;

    @Id
    @Column(length = 200, nullable = false)
    private String id;

    @Column(name = "submission_id", length = 36, nullable = false)
    private String submissionId;

    @Column(name = "voter_id", length = VOTER_ID_MAX, nullable = false)
    private String voterId;

    @Enumerated(EnumType.STRING)
    @Column(name = "vote_type", length = 16, nullable = false)
    private VoteType type;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAt;

    @Column(name = "voted_at_utc", nullable = false)
    private Instant votedAt;

    public static String idOf(String submissionId, String voterId) {
        return submissionId + ":" + voterId;
    }

    public static CategoryVoteEntity newVote(String submissionId, String voterId, VoteType type, Instant now) {
        CategoryVoteEntity v = new CategoryVoteEntity();
        v.id = idOf(submissionId, voterId);
        v.submissionId = submissionId;
        v.voterId = voterId;
        v.type = type;
        v.createdAt = now;
        v.votedAt = now;
        return v;
    }

    @Override
    public CategoryVoteEntity copy() {
        CategoryVoteEntity c = new CategoryVoteEntity();
        c.id = id;
        c.submissionId = submissionId;
        c.voterId = voterId;
        c.type = type;
        c.createdAt = createdAt;
        c.votedAt = votedAt;
        return c;
    }
}
