package com.flavorsnap.backend.common.storage;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.storage.local")
public class StorageProperties {

    /** 上傳圖片落地的根目錄（object key 一律相對於這裡） */
    @NotBlank
    private String baseDir = "./data";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
}
