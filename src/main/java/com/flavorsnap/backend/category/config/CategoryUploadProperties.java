package com.flavorsnap.backend.category.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.categories.upload")
public class CategoryUploadProperties {

    /** 一次 submission 最多幾張圖 */
    @Min(1)
    @Max(50)
    private int maxImages = 10;

    /** 圖片 object key 前綴：<keyPrefix>/<uuid><ext> */
    @NotBlank
    private String keyPrefix = "categories";

    public int getMaxImages() { return maxImages; }
    public void setMaxImages(int maxImages) { this.maxImages = maxImages; }

    public String getKeyPrefix() { return keyPrefix; }
    public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
}
