package com.brados.backend.progression.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.progression")
public class ProgressionProperties {

    /** Missed weeks in a row that trigger a weight regression */
    private int failureThreshold = 2;

    /**
     * Extra deload every N weeks inside the block; 0 = only the final week of the
     * mesocycle is a deload week.
     */
    private int deloadEveryWeeks = 0;

    public int getFailureThreshold() { return failureThreshold; }
    public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

    public int getDeloadEveryWeeks() { return deloadEveryWeeks; }
    public void setDeloadEveryWeeks(int deloadEveryWeeks) { this.deloadEveryWeeks = deloadEveryWeeks; }
}
