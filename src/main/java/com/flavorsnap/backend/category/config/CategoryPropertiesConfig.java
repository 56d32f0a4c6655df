package com.flavorsnap.backend.category.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({TrainingQueueProperties.class, CategoryUploadProperties.class})
public class CategoryPropertiesConfig {
}
