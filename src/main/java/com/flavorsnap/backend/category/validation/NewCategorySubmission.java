package com.flavorsnap.backend.category.validation;

/** 已驗證、已 trim 的文字欄位 */
public record NewCategorySubmission(String name, String description, String submittedBy) {}
