package com.brados.backend.workout.controller;

import com.brados.backend.workout.dto.ModifySetCountResponse;
import com.brados.backend.workout.dto.WorkoutDetailDto;
import com.brados.backend.workout.dto.WorkoutDto;
import com.brados.backend.workout.dto.WorkoutSummaryDto;
import com.brados.backend.workout.service.WorkoutService;
import com.brados.backend.workout.service.WorkoutSetService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Workout", description = "Scheduled workouts: start / complete / skip, add or remove sets")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/workouts")
public class WorkoutController {

    private final WorkoutService workoutService;
    private final WorkoutSetService setService;

    /** 204 when nothing is scheduled today. */
    @GetMapping("/today")
    public ResponseEntity<WorkoutDetailDto> today() {
        return workoutService.today()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}")
    public WorkoutDetailDto get(@PathVariable Long id) {
        return workoutService.getById(id);
    }

    @GetMapping
    public List<WorkoutSummaryDto> list(@RequestParam Long mesocycleId) {
        return workoutService.listByMesocycle(mesocycleId);
    }

    @PutMapping("/{id}/start")
    public WorkoutDto start(@PathVariable Long id) {
        return workoutService.start(id);
    }

    @PutMapping("/{id}/complete")
    public WorkoutDto complete(@PathVariable Long id) {
        return workoutService.complete(id);
    }

    @PutMapping("/{id}/skip")
    public WorkoutDto skip(@PathVariable Long id) {
        return workoutService.skip(id);
    }

    @PostMapping("/{id}/exercises/{exerciseId}/sets/add")
    public ResponseEntity<ModifySetCountResponse> addSet(@PathVariable Long id, @PathVariable Long exerciseId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(setService.addSet(id, exerciseId));
    }

    @DeleteMapping("/{id}/exercises/{exerciseId}/sets/remove")
    public ModifySetCountResponse removeSet(@PathVariable Long id, @PathVariable Long exerciseId) {
        return setService.removeSet(id, exerciseId);
    }
}
