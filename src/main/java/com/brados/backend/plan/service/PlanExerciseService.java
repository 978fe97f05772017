package com.brados.backend.plan.service;

import com.brados.backend.common.error.NotFoundException;
import com.brados.backend.common.error.ValidationException;
import com.brados.backend.mesocycle.entity.Mesocycle;
import com.brados.backend.mesocycle.repo.MesocycleRepository;
import com.brados.backend.mesocycle.service.PlanDayDiff;
import com.brados.backend.mesocycle.service.PlanModificationService;
import com.brados.backend.mesocycle.service.PlanSyncResult;
import com.brados.backend.plan.dto.AddPlanExerciseRequest;
import com.brados.backend.plan.dto.PlanExerciseChangeResponse;
import com.brados.backend.plan.dto.PlanExerciseDto;
import com.brados.backend.plan.dto.UpdatePlanExerciseRequest;
import com.brados.backend.plan.entity.Exercise;
import com.brados.backend.plan.entity.PlanDay;
import com.brados.backend.plan.entity.PlanDayExercise;
import com.brados.backend.plan.repo.ExerciseRepository;
import com.brados.backend.plan.repo.PlanDayExerciseRepository;
import com.brados.backend.plan.repo.PlanDayRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Edits the exercises of a plan day. When the plan has an active mesocycle, every
 * edit is pushed into its pending workouts in the same transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanExerciseService {

    private final PlanDayRepository planDayRepo;
    private final PlanDayExerciseRepository planExerciseRepo;
    private final ExerciseRepository exerciseRepo;
    private final MesocycleRepository mesocycleRepo;
    private final PlanModificationService planModification;

    @Transactional(readOnly = true)
    public List<PlanExerciseDto> list(Long planId, Long dayId) {
        loadDay(planId, dayId);
        return planExerciseRepo.findByPlanDayIdOrderBySortOrderAscIdAsc(dayId).stream()
                .map(PlanExerciseDto::from)
                .toList();
    }

    @Transactional
    public PlanExerciseChangeResponse add(Long planId, Long dayId, AddPlanExerciseRequest req) {
        loadDay(planId, dayId);
        loadExercise(req.exerciseId());

        PlanDayExercise pde = new PlanDayExercise();
        pde.setPlanDayId(dayId);
        pde.setExerciseId(req.exerciseId());
        if (req.sets() != null) pde.setSets(req.sets());
        if (req.reps() != null) pde.setReps(req.reps());
        if (req.weight() != null) pde.setWeight(req.weight());
        if (req.minReps() != null) pde.setMinReps(req.minReps());
        if (req.maxReps() != null) pde.setMaxReps(req.maxReps());
        if (req.restSeconds() != null) pde.setRestSeconds(req.restSeconds());
        pde.setSortOrder(planExerciseRepo.findByPlanDayIdOrderBySortOrderAscIdAsc(dayId).size());
        checkRepRange(pde);
        pde = planExerciseRepo.save(pde);

        PlanSyncResult sync = activeMesocycle(planId)
                .map(m -> planModification.syncPlanToMesocycle(m.getId(), dayId))
                .orElse(null);
        log.info("plan_exercise_added planId={} dayId={} id={} exerciseId={}", planId, dayId, pde.getId(), pde.getExerciseId());
        return new PlanExerciseChangeResponse(PlanExerciseDto.from(pde), sync);
    }

    @Transactional
    public PlanExerciseChangeResponse update(Long planId, Long dayId, Long id, UpdatePlanExerciseRequest req) {
        loadDay(planId, dayId);
        PlanDayExercise pde = loadPlanExercise(dayId, id);
        PlanDayExercise before = pde.copy();

        if (req.sets() != null) pde.setSets(req.sets());
        if (req.reps() != null) pde.setReps(req.reps());
        if (req.weight() != null) pde.setWeight(req.weight());
        if (req.minReps() != null) pde.setMinReps(req.minReps());
        if (req.maxReps() != null) pde.setMaxReps(req.maxReps());
        if (req.restSeconds() != null) pde.setRestSeconds(req.restSeconds());
        checkRepRange(pde);
        planExerciseRepo.save(pde);

        PlanDayDiff diff = PlanModificationService.diffPlanDayExercises(List.of(before), List.of(pde));
        boolean retarget = diff.modified().stream().anyMatch(m -> m.changes().affectsTargets());

        PlanSyncResult sync = null;
        Optional<Mesocycle> active = activeMesocycle(planId);
        if (active.isPresent()) {
            sync = retarget
                    ? planModification.updateExerciseTargetsForFutureWorkouts(
                            active.get().getId(), pde, loadExercise(pde.getExerciseId()))
                    : PlanSyncResult.empty();
        }
        log.info("plan_exercise_updated planId={} dayId={} id={} retarget={}", planId, dayId, id, retarget);
        return new PlanExerciseChangeResponse(PlanExerciseDto.from(pde), sync);
    }

    /** Sets already logged in a running mesocycle are kept. */
    @Transactional
    public PlanExerciseChangeResponse remove(Long planId, Long dayId, Long id) {
        loadDay(planId, dayId);
        PlanDayExercise pde = loadPlanExercise(dayId, id);
        planExerciseRepo.delete(pde);

        PlanSyncResult sync = activeMesocycle(planId)
                .map(m -> planModification.removeExerciseFromFutureWorkouts(m.getId(), dayId, id))
                .orElse(null);
        log.info("plan_exercise_removed planId={} dayId={} id={}", planId, dayId, id);
        return new PlanExerciseChangeResponse(null, sync);
    }

    // ===== helpers =====

    private PlanDay loadDay(Long planId, Long dayId) {
        return planDayRepo.findById(dayId)
                .filter(d -> d.getPlanId().equals(planId))
                .orElseThrow(() -> new NotFoundException("PlanDay", dayId));
    }

    private PlanDayExercise loadPlanExercise(Long dayId, Long id) {
        return planExerciseRepo.findById(id)
                .filter(e -> e.getPlanDayId().equals(dayId))
                .orElseThrow(() -> new NotFoundException("PlanDayExercise", id));
    }

    private Exercise loadExercise(Long id) {
        return exerciseRepo.findById(id).orElseThrow(() -> new NotFoundException("Exercise", id));
    }

    private Optional<Mesocycle> activeMesocycle(Long planId) {
        return mesocycleRepo.findFirstByPlanIdAndStatus(planId, Mesocycle.Status.ACTIVE);
    }

    private static void checkRepRange(PlanDayExercise pde) {
        if (pde.getMinReps() > pde.getMaxReps()) {
            throw new ValidationException("minReps " + pde.getMinReps() + " is greater than maxReps " + pde.getMaxReps());
        }
    }
}
