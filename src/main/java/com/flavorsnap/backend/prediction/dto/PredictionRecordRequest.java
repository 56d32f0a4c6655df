package com.flavorsnap.backend.prediction.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/** 舊 client 送 image_url，一併接受 */
public record PredictionRecordRequest(
        String label,
        Double confidence,
        @JsonAlias("image_url") String imageUrl
) {}
