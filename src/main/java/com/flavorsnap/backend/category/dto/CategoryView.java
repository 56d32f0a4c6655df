package com.flavorsnap.backend.category.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CategoryView(
        String id,
        String name,
        String description,
        String submittedBy,
        Instant submittedAt,
        String status,
        List<String> images,
        int votesUp,
        int votesDown,
        int netVotes,
        String moderatorNotes,
        String moderatedBy,
        Instant moderatedAt
) {
    public static CategoryView of(CategorySubmissionEntity e) {
        return new CategoryView(
                e.getId(),
                e.getName(),
                e.getDescription(),
                e.getSubmittedBy(),
                e.getSubmittedAt(),
                e.getStatus().name(),
                List.copyOf(e.getImages()),
                e.getVotesUp(),
                e.getVotesDown(),
                e.netVotes(),
                e.getModeratorNotes(),
                e.getModeratedBy(),
                e.getModeratedAt()
        );
    }
}
