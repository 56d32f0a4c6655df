package com.flavorsnap.backend.category.service;

import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.common.query.RecordSchema;
import com.flavorsnap.backend.common.query.SortDirection;

import java.util.Comparator;

/** 可以 filter / sort 的 category 欄位（不在這裡的參數一律忽略） */
final class CategorySchemas {

    private CategorySchemas() {}

    static final RecordSchema<CategorySubmissionEntity> SUBMISSIONS = RecordSchema
            .<CategorySubmissionEntity>builder(CategorySubmissionEntity::getId)
            .match("status", CategorySubmissionEntity::getStatus)
            .match("name", CategorySubmissionEntity::getName)
            .match("submittedBy", CategorySubmissionEntity::getSubmittedBy)
            .number("votesUp", CategorySubmissionEntity::getVotesUp)
            .number("votesDown", CategorySubmissionEntity::getVotesDown)
            .computedNumber("totalVotes", CategorySubmissionEntity::totalVotes)
            .time("submittedAt", CategorySubmissionEntity::getSubmittedAt)
            .sortable("submittedAt",
                    Comparator.comparing(CategorySubmissionEntity::getSubmittedAt, Comparator.nullsFirst(Comparator.naturalOrder())),
                    e -> String.valueOf(e.getSubmittedAt()))
            .sortable("name",
                    Comparator.comparing(CategorySubmissionEntity::getName, String.CASE_INSENSITIVE_ORDER),
                    CategorySubmissionEntity::getName)
            .sortable("status",
                    Comparator.comparing(CategorySubmissionEntity::getStatus),
                    e -> e.getStatus().name())
            .sortable("votesUp",
                    Comparator.comparingInt(CategorySubmissionEntity::getVotesUp),
                    e -> String.valueOf(e.getVotesUp()))
            .sortable("votesDown",
                    Comparator.comparingInt(CategorySubmissionEntity::getVotesDown),
                    e -> String.valueOf(e.getVotesDown()))
            .sortable("netVotes",
                    Comparator.comparingInt(CategorySubmissionEntity::netVotes),
                    e -> String.valueOf(e.netVotes()))
            .defaultSort("submittedAt", SortDirection.DESC)
            .build();
}
