package com.flavorsnap.backend.category.dto;

import java.util.List;

/**
 * JSON 版 submission：images 是已經存好的 object key / URL
 */
public record CategorySubmitRequest(
        String name,
        String description,
        String submittedBy,
        List<String> images
) {}
