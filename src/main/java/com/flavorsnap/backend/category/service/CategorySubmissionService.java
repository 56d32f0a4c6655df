package com.flavorsnap.backend.category.service;

import com.flavorsnap.backend.category.config.CategoryUploadProperties;
import com.flavorsnap.backend.category.dto.CategoryStatsResponse;
import com.flavorsnap.backend.category.dto.CategorySubmitRequest;
import com.flavorsnap.backend.category.entity.CategorySubmissionEntity;
import com.flavorsnap.backend.category.model.CategoryStatus;
import com.flavorsnap.backend.category.model.TrainingStatus;
import com.flavorsnap.backend.category.validation.CategoryRequestValidator;
import com.flavorsnap.backend.category.validation.NewCategorySubmission;
import com.flavorsnap.backend.common.error.ValidationException;
import com.flavorsnap.backend.common.image.ImageIntakeService;
import com.flavorsnap.backend.common.query.ListQuery;
import com.flavorsnap.backend.common.query.PageResult;
import com.flavorsnap.backend.common.query.QueryEngine;
import com.flavorsnap.backend.common.store.RecordStore;
import com.flavorsnap.backend.common.store.StoreFilter;
import com.flavorsnap.backend.common.telemetry.PipelineTelemetry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class CategorySubmissionService {

    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final int DEFAULT_MIN_VOTES = 10;
    public static final int DEFAULT_POPULAR_LIMIT = 20;
    public static final int MAX_POPULAR_LIMIT = 50;

    /** net desc -> up desc -> id asc */
    static final Comparator<CategorySubmissionEntity> POPULAR_ORDER = Comparator
            .comparingInt(CategorySubmissionEntity::netVotes).reversed()
            .thenComparing(Comparator.comparingInt(CategorySubmissionEntity::getVotesUp).reversed())
            .thenComparing(CategorySubmissionEntity::getId);

    private final RecordStore<CategorySubmissionEntity> submissions;
    private final CategoryRequestValidator validator;
    private final ImageIntakeService images;
    private final CategoryUploadProperties uploadProps;
    private final TrainingQueueCoordinator trainingQueue;
    private final QueryEngine queryEngine;
    private final PipelineTelemetry telemetry;
    private final Clock clock;

    /** JSON：images 已經是 object key */
    public CategorySubmissionEntity submit(CategorySubmitRequest req) {
        if (req == null) throw new ValidationException("BAD_REQUEST", "Request body is required");
        List<String> refs = validator.imageRefs(req.images()).orElseThrow();
        NewCategorySubmission v = validator
                .validate(req.name(), req.description(), req.submittedBy(), refs.size())
                .orElseThrow();
        return create(v, refs);
    }

    /**
     * multipart：先 sniff 全部檔案、驗證欄位，通過後才落地存檔。
     * 不是 png/jpg/gif/bmp/webp 的檔案直接略過
     */
    public CategorySubmissionEntity submitUpload(String name, String description, String submittedBy,
                                                 List<MultipartFile> files) {
        List<ImageIntakeService.AcceptedImage> accepted = new ArrayList<>();
        if (files != null) {
            for (MultipartFile f : files) {
                ImageIntakeService.AcceptedImage img = images.sniff(f);
                if (img != null) accepted.add(img);
            }
        }

        NewCategorySubmission v = validator.validate(name, description, submittedBy, accepted.size()).orElseThrow();

        List<String> keys = new ArrayList<>(accepted.size());
        for (ImageIntakeService.AcceptedImage img : accepted) {
            keys.add(images.store(img, uploadProps.getKeyPrefix()).objectKey());
        }
        return create(v, keys);
    }

    private CategorySubmissionEntity create(NewCategorySubmission v, List<String> imageKeys) {
        CategorySubmissionEntity e = new CategorySubmissionEntity();
        e.setName(v.name());
        e.setDescription(v.description());
        e.setSubmittedBy(v.submittedBy());
        e.setSubmittedAt(Instant.now(clock));
        e.setStatus(CategoryStatus.PENDING);
        e.setImages(new ArrayList<>(imageKeys));
        e.setVotesUp(0);
        e.setVotesDown(0);

        CategorySubmissionEntity saved = submissions.create(e);
        telemetry.categorySubmitted(saved.getId(), saved.getSubmittedBy(), imageKeys.size());
        return saved;
    }

    public CategorySubmissionEntity get(String id) {
        return submissions.get(id);
    }

    /**
     * @param status null = 全部；不認得的值直接 400（不是 silently 忽略）
     */
    public PageResult<CategorySubmissionEntity> list(String status, Integer limit, Integer offset,
                                                     String sortBy, String sortDir, String cursor) {
        ListQuery.ListQueryBuilder q = ListQuery.builder()
                .limit(limit)
                .offset(offset == null ? 0 : offset)
                .sortBy(sortBy)
                .sortDir(sortDir)
                .cursor(cursor);

        if (status != null && !status.isBlank()) {
            CategoryStatus s = CategoryStatus.parseOrNull(status);
            if (s == null) throw new ValidationException("INVALID_STATUS", "Invalid status: " + status.trim());
            q.anyOf(Map.of("status", Set.of(s.name())));
        }
        return queryEngine.list(submissions, CategorySchemas.SUBMISSIONS, q.build(), DEFAULT_LIST_LIMIT);
    }

    public List<CategorySubmissionEntity> popular(Integer minVotes, Integer limit) {
        int min = Math.max(1, minVotes == null ? DEFAULT_MIN_VOTES : minVotes);
        int lim = Math.max(1, Math.min(MAX_POPULAR_LIMIT, limit == null ? DEFAULT_POPULAR_LIMIT : limit));

        StoreFilter<CategorySubmissionEntity> filter = StoreFilter.<CategorySubmissionEntity>all()
                .in("status", CategorySubmissionEntity::getStatus, List.of(CategoryStatus.PENDING))
                .sumAtLeast(List.of("votesUp", "votesDown"), CategorySubmissionEntity::totalVotes, min);
        return submissions.scan(filter)
                .stream()
                .sorted(POPULAR_ORDER)
                .limit(lim)
                .toList();
    }

    public CategoryStatsResponse stats() {
        StoreFilter<CategorySubmissionEntity> all = StoreFilter.all();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        long total = 0;
        for (CategoryStatus s : CategoryStatus.values()) {
            long n = submissions.count(all.in("status", CategorySubmissionEntity::getStatus, List.of(s)));
            byStatus.put(s.name(), n);
            total += n;
        }
        long up = submissions.sum("votesUp", CategorySubmissionEntity::getVotesUp, all);
        long down = submissions.sum("votesDown", CategorySubmissionEntity::getVotesDown, all);

        EnumMap<TrainingStatus, Long> jobs = trainingQueue.summary();
        Map<String, Long> jobCounts = new LinkedHashMap<>();
        jobs.forEach((k, v) -> jobCounts.put(k.name(), v));
        long queueSize = jobs.get(TrainingStatus.QUEUED) + jobs.get(TrainingStatus.TRAINING);

        return new CategoryStatsResponse(total, byStatus, up, down, queueSize, jobCounts);
    }
}
