package com.flavorsnap.backend.category.dto;

import java.util.List;

public record TrainingQueueResponse(List<TrainingQueueItem> items, int count) {}
