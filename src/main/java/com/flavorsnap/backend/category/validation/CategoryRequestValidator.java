package com.flavorsnap.backend.category.validation;

import com.flavorsnap.backend.category.config.CategoryUploadProperties;
import com.flavorsnap.backend.common.validation.Validated;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Raw submission input -> typed value. Never throws; the caller decides what to do with the error.
 */
@Component
public class CategoryRequestValidator {

    public static final int NAME_MAX = 100;
    public static final int SUBMITTED_BY_MAX = 128;
    public static final int DESCRIPTION_MAX = 2000;

    private final CategoryUploadProperties props;

    public CategoryRequestValidator(CategoryUploadProperties props) {
        this.props = props;
    }

    /**
     * @param imageCount images that survived intake (already-stored refs or sniffed uploads)
     */
    public Validated<NewCategorySubmission> validate(String name, String description, String submittedBy, int imageCount) {
        String n = trimToNull(name);
        String d = trimToNull(description);
        String by = trimToNull(submittedBy);

        if (n == null) return Validated.invalid("NAME_REQUIRED", "name is required");
        if (d == null) return Validated.invalid("DESCRIPTION_REQUIRED", "description is required");
        if (by == null) return Validated.invalid("SUBMITTED_BY_REQUIRED", "submittedBy is required");

        if (n.length() > NAME_MAX) {
            return Validated.invalid("NAME_TOO_LONG", "name must be at most " + NAME_MAX + " characters");
        }
        if (d.length() > DESCRIPTION_MAX) {
            return Validated.invalid("DESCRIPTION_TOO_LONG", "description must be at most " + DESCRIPTION_MAX + " characters");
        }
        if (by.length() > SUBMITTED_BY_MAX) {
            return Validated.invalid("SUBMITTED_BY_TOO_LONG", "submittedBy must be at most " + SUBMITTED_BY_MAX + " characters");
        }

        if (imageCount < 1) return Validated.invalid("IMAGES_REQUIRED", "At least one image is required");
        if (imageCount > props.getMaxImages()) {
            return Validated.invalid("TOO_MANY_IMAGES", "At most " + props.getMaxImages() + " images are allowed");
        }
        return Validated.valid(new NewCategorySubmission(n, d, by));
    }

    /**
     * JSON 版的圖片參照：trim、去掉空白項；不允許 path traversal。
     * 空 list 不在這裡擋，交給 {@link #validate} 的 imageCount。
     */
    public Validated<List<String>> imageRefs(List<String> raw) {
        if (raw == null) return Validated.valid(List.of());
        List<String> refs = raw.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        for (String r : refs) {
            if (r.contains("..") || r.length() > 512) {
                return Validated.invalid("INVALID_IMAGE_REF", "Invalid image reference");
            }
        }
        return Validated.valid(refs);
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
