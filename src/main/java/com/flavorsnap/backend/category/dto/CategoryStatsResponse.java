package com.flavorsnap.backend.category.dto;

import java.util.Map;

public record CategoryStatsResponse(
        long totalCategories,
        Map<String, Long> byStatus,
        long totalUpvotes,
        long totalDownvotes,
        long trainingQueueSize,
        Map<String, Long> trainingJobs
) {}
