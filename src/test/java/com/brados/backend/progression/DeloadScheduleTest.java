package com.brados.backend.progression;

import com.brados.backend.progression.service.DeloadSchedule;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeloadScheduleTest {

    @Test
    void defaultCadence_onlyFinalWeekIsDeload() {
        DeloadSchedule s = new DeloadSchedule(0);
        for (int w = 1; w < 7; w++) assertFalse(s.isDeloadWeek(w, 7), "week " + w);
        assertTrue(s.isDeloadWeek(7, 7));
    }

    @Test
    void everyThirdWeek_shouldAddMidBlockDeloads() {
        DeloadSchedule s = new DeloadSchedule(3);
        assertTrue(s.isDeloadWeek(3, 9));
        assertTrue(s.isDeloadWeek(6, 9));
        assertFalse(s.isDeloadWeek(4, 9));
        assertTrue(s.isDeloadWeek(9, 9));
    }
}
