package com.flavorsnap.backend.category.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * queue 列表：job + category 的 join view（worker 拿到就能直接抓圖訓練）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrainingQueueItem(
        String jobId,
        String categoryId,
        String status,
        Instant createdAt,
        Instant startedAt,
        String name,
        String description,
        List<String> images
) {}
