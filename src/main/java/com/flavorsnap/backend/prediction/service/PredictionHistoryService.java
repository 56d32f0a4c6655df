package com.flavorsnap.backend.prediction.service;

import com.flavorsnap.backend.common.error.ValidationException;
import com.flavorsnap.backend.common.image.ImageIntakeService;
import com.flavorsnap.backend.common.query.ListQuery;
import com.flavorsnap.backend.common.query.PageResult;
import com.flavorsnap.backend.common.query.QueryEngine;
import com.flavorsnap.backend.common.query.RecordSchema;
import com.flavorsnap.backend.common.query.SortDirection;
import com.flavorsnap.backend.common.store.RecordStore;
import com.flavorsnap.backend.common.telemetry.PipelineTelemetry;
import com.flavorsnap.backend.common.validation.Validated;
import com.flavorsnap.backend.prediction.classifier.FoodClassifier;
import com.flavorsnap.backend.prediction.entity.PredictionEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@Service
@RequiredArgsConstructor
public class PredictionHistoryService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int LABEL_MAX = 100;
    public static final String IMAGE_KEY_PREFIX = "predictions";

    static final RecordSchema<PredictionEntity> SCHEMA = RecordSchema
            .<PredictionEntity>builder(PredictionEntity::getId)
            .match("label", PredictionEntity::getLabel)
            .number("confidence", PredictionEntity::getConfidence)
            .time("createdAt", PredictionEntity::getCreatedAt)
            .sortable("createdAt",
                    Comparator.comparing(PredictionEntity::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())),
                    p -> String.valueOf(p.getCreatedAt()))
            .sortable("confidence",
                    Comparator.comparingDouble(PredictionEntity::getConfidence),
                    p -> String.valueOf(p.getConfidence()))
            .sortable("label",
                    Comparator.comparing(PredictionEntity::getLabel, String.CASE_INSENSITIVE_ORDER),
                    PredictionEntity::getLabel)
            .defaultSort("createdAt", SortDirection.DESC)
            .build();

    private final RecordStore<PredictionEntity> predictions;
    private final FoodClassifier classifier;
    private final ImageIntakeService images;
    private final QueryEngine queryEngine;
    private final PipelineTelemetry telemetry;
    private final Clock clock;

    public PredictionEntity record(String label, Double confidence, String imageUrl,
                                   List<PredictionEntity.LabelScore> topPredictions) {
        PredictionEntity e = validate(label, confidence, imageUrl).orElseThrow();
        e.setTopPredictions(topPredictions == null ? null : List.copyOf(topPredictions));
        e.setCreatedAt(Instant.now(clock));

        PredictionEntity saved = predictions.create(e);
        telemetry.predictionRecorded(saved.getId(), saved.getLabel(), saved.getConfidence());
        return saved;
    }

    /** 上傳 -> 存檔 -> classifier -> 記錄 */
    public PredictionEntity classifyAndRecord(MultipartFile image) {
        ImageIntakeService.AcceptedImage img = images.sniff(image);
        if (img == null) {
            throw new ValidationException("UNSUPPORTED_IMAGE", "Image must be png, jpg, jpeg, gif, bmp or webp");
        }
        String key = images.store(img, IMAGE_KEY_PREFIX).objectKey();

        FoodClassifier.Classification c = classifier.classify(img.bytes(), img.detection().contentType());
        return record(c.label(), c.confidence(), key, c.top());
    }

    public PageResult<PredictionEntity> list(ListQuery query) {
        return queryEngine.list(predictions, SCHEMA, query, DEFAULT_LIMIT);
    }

    static Validated<PredictionEntity> validate(String label, Double confidence, String imageUrl) {
        String l = label == null ? null : label.trim();
        if (l == null || l.isEmpty()) return Validated.invalid("LABEL_REQUIRED", "label is required");
        if (l.length() > LABEL_MAX) {
            return Validated.invalid("LABEL_TOO_LONG", "label must be at most " + LABEL_MAX + " characters");
        }
        if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            return Validated.invalid("INVALID_CONFIDENCE", "confidence must be between 0 and 1");
        }

        String url = imageUrl == null || imageUrl.isBlank() ? null : imageUrl.trim();
        if (url != null && url.length() > PredictionEntity.IMAGE_URL_MAX) {
            return Validated.invalid("IMAGE_URL_TOO_LONG", "imageUrl must be at most " + PredictionEntity.IMAGE_URL_MAX + " characters");
        }

        PredictionEntity e = new PredictionEntity();
        e.setLabel(l);
        e.setConfidence(confidence);
        e.setImageUrl(url);
        return Validated.valid(e);
    }
}
