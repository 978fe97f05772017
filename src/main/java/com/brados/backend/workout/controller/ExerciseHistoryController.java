package com.brados.backend.workout.controller;

import com.brados.backend.workout.dto.ExerciseHistoryDto;
import com.brados.backend.workout.service.ExerciseHistoryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Exercise history", description = "Completed sessions and personal record of one exercise")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/exercises")
public class ExerciseHistoryController {

    private final ExerciseHistoryService historyService;

    @GetMapping("/{id}/history")
    public ExerciseHistoryDto history(@PathVariable Long id) {
        return historyService.getHistory(id);
    }
}
