package com.flavorsnap.backend.category.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.training")
public class TrainingQueueProperties {

    /**
     * false = 跟 worker 回報什麼就寫什麼（worker 是可信的）
     * true  = 只接受 QUEUED -> TRAINING|FAILED、TRAINING -> COMPLETED|FAILED
     */
    private boolean strictTransitions = false;

    /** health：QUEUED 超過這個數量就在 detail 標 backlog=true（不會變 DOWN） */
    @Min(1)
    private int backlogWarnThreshold = 100;

    public boolean isStrictTransitions() { return strictTransitions; }
    public void setStrictTransitions(boolean strictTransitions) { this.strictTransitions = strictTransitions; }

    public int getBacklogWarnThreshold() { return backlogWarnThreshold; }
    public void setBacklogWarnThreshold(int backlogWarnThreshold) { this.backlogWarnThreshold = backlogWarnThreshold; }
}
