package com.flavorsnap.backend.prediction.classifier;

import com.flavorsnap.backend.prediction.entity.PredictionEntity;

import java.util.List;

/**
 * The image model lives outside this service; this is the seam it plugs into.
 */
public interface FoodClassifier {

    Classification classify(byte[] image, String contentType);

    /**
     * @param top sorted by confidence desc; first element equals (label, confidence)
     */
    record Classification(String label, double confidence, List<PredictionEntity.LabelScore> top) {}
}
