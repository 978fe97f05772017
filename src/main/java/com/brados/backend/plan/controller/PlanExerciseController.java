package com.brados.backend.plan.controller;

import com.brados.backend.plan.dto.AddPlanExerciseRequest;
import com.brados.backend.plan.dto.PlanExerciseChangeResponse;
import com.brados.backend.plan.dto.PlanExerciseDto;
import com.brados.backend.plan.dto.UpdatePlanExerciseRequest;
import com.brados.backend.plan.service.PlanExerciseService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Plan", description = "Exercises of a plan day; edits reach the running mesocycle")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/plans/{planId}/days/{dayId}/exercises")
public class PlanExerciseController {

    private final PlanExerciseService service;

    @GetMapping
    public List<PlanExerciseDto> list(@PathVariable Long planId, @PathVariable Long dayId) {
        return service.list(planId, dayId);
    }

    @PostMapping
    public ResponseEntity<PlanExerciseChangeResponse> add(@PathVariable Long planId, @PathVariable Long dayId,
                                                          @Valid @RequestBody AddPlanExerciseRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.add(planId, dayId, req));
    }

    @PutMapping("/{id}")
    public PlanExerciseChangeResponse update(@PathVariable Long planId, @PathVariable Long dayId,
                                             @PathVariable Long id,
                                             @Valid @RequestBody UpdatePlanExerciseRequest req) {
        return service.update(planId, dayId, id, req);
    }

    @DeleteMapping("/{id}")
    public PlanExerciseChangeResponse remove(@PathVariable Long planId, @PathVariable Long dayId,
                                             @PathVariable Long id) {
        return service.remove(planId, dayId, id);
    }
}
