package com.flavorsnap.backend.category.dto;

public record TrainingStatusRequest(String status, String errorMessage) {}
