package com.flavorsnap.backend.prediction.controller;

import com.flavorsnap.backend.common.query.ListQuery;
import com.flavorsnap.backend.common.query.NumberRange;
import com.flavorsnap.backend.common.query.PageResult;
import com.flavorsnap.backend.common.query.TimeRange;
import com.flavorsnap.backend.prediction.dto.PredictionListResponse;
import com.flavorsnap.backend.prediction.dto.PredictionRecordRequest;
import com.flavorsnap.backend.prediction.dto.PredictionView;
import com.flavorsnap.backend.prediction.service.PredictionHistoryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Tag(name = "Predictions", description = "Classifier results + filterable history")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/predictions")
public class PredictionController {

    private final PredictionHistoryService historyService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public PredictionView classify(@RequestPart("image") MultipartFile image) {
        return PredictionView.of(historyService.classifyAndRecord(image));
    }

    @PostMapping(value = "/history", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public PredictionView record(@RequestBody PredictionRecordRequest body) {
        return PredictionView.of(historyService.record(body.label(), body.confidence(), body.imageUrl(), null));
    }

    /**
     * label 可用逗號分隔（label=Akara,Yam）；from / to 接受 ISO-8601 instant / date-time / date
     */
    @GetMapping
    public PredictionListResponse list(
            @RequestParam(value = "label", required = false) String label,
            @RequestParam(value = "minConfidence", required = false) Double minConfidence,
            @RequestParam(value = "maxConfidence", required = false) Double maxConfidence,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "sortBy", required = false) String sortBy,
            @RequestParam(value = "sortDir", required = false) String sortDir,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "offset", required = false) Integer offset,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "cursor", required = false) String cursor
    ) {
        Map<String, Set<String>> anyOf = new HashMap<>();
        if (label != null && !label.isBlank()) {
            Set<String> labels = Arrays.stream(label.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toSet());
            if (!labels.isEmpty()) anyOf.put("label", labels);
        }

        Map<String, NumberRange> numbers = new HashMap<>();
        if (minConfidence != null || maxConfidence != null) {
            numbers.put("confidence", new NumberRange(minConfidence, maxConfidence));
        }

        Map<String, TimeRange> times = new HashMap<>();
        if (from != null || to != null) {
            times.put("createdAt", new TimeRange(from, to));
        }

        ListQuery q = ListQuery.builder()
                .anyOf(anyOf)
                .numberRanges(numbers)
                .timeRanges(times)
                .sortBy(sortBy)
                .sortDir(sortDir)
                .page(page)
                .offset(offset)
                .limit(limit)
                .cursor(cursor)
                .build();

        PageResult<PredictionView> result = historyService.list(q).map(PredictionView::of);
        return new PredictionListResponse(result.items(), result.pagination());
    }
}
