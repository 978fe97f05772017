package com.brados.backend.progression.service;

import com.brados.backend.progression.config.ProgressionProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Which weeks of a block are deload weeks: always the final one, plus every
 * {@code deloadEveryWeeks}-th week when that cadence is configured.
 */
@Component
public class DeloadSchedule {

    private final int everyWeeks;

    @Autowired
    public DeloadSchedule(ProgressionProperties props) {
        this(props.getDeloadEveryWeeks());
    }

    public DeloadSchedule(int everyWeeks) {
        this.everyWeeks = Math.max(0, everyWeeks);
    }

    public boolean isDeloadWeek(int weekNumber, int durationWeeks) {
        if (weekNumber == durationWeeks) return true;
        return everyWeeks > 0 && weekNumber % everyWeeks == 0 && weekNumber < durationWeeks;
    }
}
