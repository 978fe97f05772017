package com.brados.backend.mesocycle.job;

import com.brados.backend.mesocycle.entity.Mesocycle;
import com.brados.backend.mesocycle.repo.MesocycleRepository;
import com.brados.backend.mesocycle.service.PlanModificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Moves every active mesocycle up to the week the calendar says it is in.
 * A failure on one mesocycle is logged and the scan goes on.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MesocycleWeekAdvanceJob {

    private final MesocycleRepository mesocycleRepo;
    private final PlanModificationService planModification;
    private final Clock clock;

    @Scheduled(cron = "${app.mesocycle.advance-job.cron:0 10 3 * * *}")
    @Async("weekAdvanceExecutor")
    public void run() {
        LocalDate today = LocalDate.now(clock);
        List<Mesocycle> active = mesocycleRepo.findByStatus(Mesocycle.Status.ACTIVE);

        int advanced = 0;
        int failed = 0;
        for (Mesocycle meso : active) {
            try {
                advanced += planModification.catchUp(meso.getId(), today);
            } catch (Exception ex) {
                failed++;
                log.warn("week_advance_failed mesocycleId={} week={}: {}", meso.getId(), meso.getCurrentWeek(), ex.toString());
            }
        }
        log.info("MesocycleWeekAdvanceJob finished. mesocycles={} advances={} failed={}", active.size(), advanced, failed);
    }
}
