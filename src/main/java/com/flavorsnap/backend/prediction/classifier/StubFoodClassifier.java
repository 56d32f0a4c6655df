package com.flavorsnap.backend.prediction.classifier;

import com.flavorsnap.backend.prediction.entity.PredictionEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic stand-in for the real model: same bytes, same answer.
 * 只用來讓 API / 測試跑得起來，不代表任何真實的辨識能力
 */
@Slf4j
@Component
public class StubFoodClassifier implements FoodClassifier {

    static final List<String> LABELS = List.of("Akara", "Bread", "Egusi", "Moi Moi", "Rice and Stew", "Yam");

    private static final int TOP_K = 3;

    @Override
    public Classification classify(byte[] image, String contentType) {
        int seed = Arrays.hashCode(image == null ? new byte[0] : image);

        // 把 seed 攤成每個 label 一個分數，再正規化成機率
        double[] raw = new double[LABELS.size()];
        double sum = 0;
        for (int i = 0; i < raw.length; i++) {
            int h = Integer.rotateLeft(seed, i * 5) ^ (i * 0x9E3779B9);
            raw[i] = 1 + (h & 0xFF);
            sum += raw[i];
        }

        List<PredictionEntity.LabelScore> scores = new ArrayList<>(raw.length);
        for (int i = 0; i < raw.length; i++) {
            scores.add(new PredictionEntity.LabelScore(LABELS.get(i), round4(raw[i] / sum)));
        }
        scores.sort(Comparator.comparingDouble(PredictionEntity.LabelScore::confidence).reversed()
                .thenComparing(PredictionEntity.LabelScore::label));

        List<PredictionEntity.LabelScore> top = List.copyOf(scores.subList(0, TOP_K));
        PredictionEntity.LabelScore best = top.get(0);
        log.debug("stub_classify contentType={} label={} confidence={}", contentType, best.label(), best.confidence());
        return new Classification(best.label(), best.confidence(), top);
    }

    private static double round4(double v) {
        return Math.round(v * 10_000d) / 10_000d;
    }
}
