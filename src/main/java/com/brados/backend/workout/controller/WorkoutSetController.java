package com.brados.backend.workout.controller;

import com.brados.backend.workout.dto.LogSetRequest;
import com.brados.backend.workout.dto.WorkoutSetDto;
import com.brados.backend.workout.service.WorkoutSetService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "WorkoutSet", description = "Log / skip / unlog a single set")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/workout-sets")
public class WorkoutSetController {

    private final WorkoutSetService setService;

    @PutMapping("/{id}/log")
    public WorkoutSetDto log(@PathVariable Long id, @Valid @RequestBody LogSetRequest req) {
        return setService.logSet(id, req.actualReps(), req.actualWeight());
    }

    @PutMapping("/{id}/skip")
    public WorkoutSetDto skip(@PathVariable Long id) {
        return setService.skipSet(id);
    }

    @PutMapping("/{id}/unlog")
    public WorkoutSetDto unlog(@PathVariable Long id) {
        return setService.unlogSet(id);
    }
}
