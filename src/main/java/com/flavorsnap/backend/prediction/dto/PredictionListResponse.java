package com.flavorsnap.backend.prediction.dto;

import com.flavorsnap.backend.common.query.Pagination;

import java.util.List;

public record PredictionListResponse(List<PredictionView> items, Pagination pagination) {}
