package com.flavorsnap.backend.common.store;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.store")
public class StoreProperties {

    public enum Engine { JPA, MEMORY }

    /** jpa = MySQL/H2 via Hibernate；memory = 測試 / 本機 demo 用 */
    @NotNull
    private Engine engine = Engine.JPA;

    /** 等 row lock / per-id lock 最多多久，超過就回 STORAGE_UNAVAILABLE（不要卡死 request） */
    @NotNull
    private Duration lockTimeout = Duration.ofSeconds(5);

    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }

    public Duration getLockTimeout() { return lockTimeout; }
    public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
}
