package com.flavorsnap.backend.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** ✅ 用 Clock 方便測試（service 都從這裡拿 now） */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
