package com.flavorsnap.backend.category.service;

import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.entity.CategoryVoteEntity;
import com.flavorsnap.backend.category.model.CategoryStatus;
import com.flavorsnap.backend.category.model.VoteOutcome;
import com.flavorsnap.backend.category.model.VoteType;
import com.flavorsnap.backend.common.error.ValidationException;
import com.flavorsnap.backend.common.error.VotingClosedException;
import com.flavorsnap.backend.common.store.RecordStore;
import com.flavorsnap.backend.common.telemetry.PipelineTelemetry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live vote per (submission, voter); submission counters always equal the live votes.
 * <p>
 * Everything happens inside the submission's {@link RecordStore#update}, so votes on one
 * submission serialize and the vote row + counters commit together.
 */
@Service
@RequiredArgsConstructor
public class VoteLedger {

    private final RecordStore<CategorySubmissionEntity> submissions;
    private final RecordStore<CategoryVoteEntity> votes;
    private final PipelineTelemetry telemetry;
    private final Clock clock;

    public record VoteResult(String categoryId, VoteOutcome outcome, int votesUp, int votesDown) {}

    public VoteResult castVote(String submissionId, String voterId, VoteType type) {
        String voter = voterId == null ? null : voterId.trim();
        if (voter == null || voter.isEmpty()) throw new ValidationException("VOTER_ID_REQUIRED", "voterId is required");
        if (voter.length() > CategoryVoteEntity.VOTER_ID_MAX) {
            throw new ValidationException("VOTER_ID_TOO_LONG",
                    "voterId must be at most " + CategoryVoteEntity.VOTER_ID_MAX + " characters");
        }
        if (type == null) throw new ValidationException("INVALID_VOTE_TYPE", "voteType must be upvote or downvote");

        AtomicReference<VoteOutcome> outcome = new AtomicReference<>();
        CategorySubmissionEntity after = submissions.update(submissionId, s -> {
            if (s.getStatus() != CategoryStatus.PENDING) {
                throw new VotingClosedException(submissionId, s.getStatus().name());
            }
            Instant now = Instant.now(clock);
            String voteId = CategoryVoteEntity.idOf(submissionId, voter);
            Optional<CategoryVoteEntity> existing = votes.find(voteId);

            if (existing.isEmpty()) {
                int[] next = applyDelta(s, null, type);
                votes.create(CategoryVoteEntity.newVote(submissionId, voter, type, now));
                setCounters(s, next);
                outcome.set(VoteOutcome.RECORDED);
                return;
            }

            VoteType previous = existing.get().getType();
            if (previous == type) {
                outcome.set(VoteOutcome.UNCHANGED);
                return;
            }

            // 先算好 counters（可能丟錯），再寫 vote，最後才動 submission
            int[] next = applyDelta(s, previous, type);
            votes.update(voteId, v -> {
                v.setType(type);
                v.setVotedAt(now);
            });
            setCounters(s, next);
            outcome.set(VoteOutcome.CHANGED);
        });

        telemetry.voteCast(submissionId, voter, type.name(), outcome.get().name(), after.getVotesUp(), after.getVotesDown());
        return new VoteResult(after.getId(), outcome.get(), after.getVotesUp(), after.getVotesDown());
    }

    /** @return {up, down} after removing {@code previous} (if any) and adding {@code next} */
    static int[] applyDelta(CategorySubmissionEntity s, VoteType previous, VoteType next) {
        int up = s.getVotesUp();
        int down = s.getVotesDown();
        if (previous == VoteType.UPVOTE) up--;
        if (previous == VoteType.DOWNVOTE) down--;
        if (next == VoteType.UPVOTE) up++;
        if (next == VoteType.DOWNVOTE) down++;
        if (up < 0 || down < 0) {
            throw new IllegalStateException("VOTE_COUNTER_NEGATIVE submission=" + s.getId() + " up=" + up + " down=" + down);
        }
        return new int[]{up, down};
    }

    private static void setCounters(CategorySubmissionEntity s, int[] counters) {
        s.setVotesUp(counters[0]);
        s.setVotesDown(counters[1]);
    }
}
