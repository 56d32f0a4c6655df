package com.flavorsnap.backend.category.dto;

public record ModerationRequest(String moderatorId, String action, String notes) {}
