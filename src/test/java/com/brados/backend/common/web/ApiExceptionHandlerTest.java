package com.brados.backend.common.web;

import com.brados.backend.InfoController;
import com.brados.backend.common.error.ConflictException;
import com.brados.backend.common.error.InvalidTransitionException;
import com.brados.backend.common.error.NotFoundException;
import com.brados.backend.common.error.ValidationException;
import com.brados.backend.mesocycle.controller.MesocycleController;
import com.brados.backend.mesocycle.dto.MesocycleDto;
import com.brados.backend.mesocycle.entity.Mesocycle;
import com.brados.backend.mesocycle.service.MesocycleService;
import com.brados.backend.mesocycle.service.PlanModificationService;
import com.brados.backend.mesocycle.service.PlanSyncResult;
import com.brados.backend.plan.controller.PlanExerciseController;
import com.brados.backend.plan.dto.AddPlanExerciseRequest;
import com.brados.backend.plan.dto.PlanExerciseChangeResponse;
import com.brados.backend.plan.dto.PlanExerciseDto;
import com.brados.backend.plan.service.PlanExerciseService;
import com.brados.backend.progression.config.ProgressionConfig;
import com.brados.backend.workout.controller.ExerciseHistoryController;
import com.brados.backend.workout.controller.WorkoutController;
import com.brados.backend.workout.controller.WorkoutSetController;
import com.brados.backend.workout.entity.Workout;
import com.brados.backend.workout.service.ExerciseHistoryService;
import com.brados.backend.workout.service.WorkoutService;
import com.brados.backend.workout.service.WorkoutSetService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(controllers = { InfoController.class, MesocycleController.class, WorkoutController.class,
        WorkoutSetController.class, PlanExerciseController.class, ExerciseHistoryController.class })
@Import({ApiExceptionHandler.class, RequestIdFilter.class, ProgressionConfig.class,
        ApiExceptionHandlerTest.FixedClock.class})
class ApiExceptionHandlerTest {

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2026-03-04T08:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired MockMvc mvc;

    @MockitoBean MesocycleService mesocycleService;
    @MockitoBean PlanModificationService planModification;
    @MockitoBean WorkoutService workoutService;
    @MockitoBean WorkoutSetService setService;
    @MockitoBean PlanExerciseService planExerciseService;
    @MockitoBean ExerciseHistoryService historyService;

    @Test
    void create_shouldReturn201() throws Exception {
        Mockito.when(mesocycleService.create(1L, LocalDate.of(2026, 3, 2))).thenReturn(
                new MesocycleDto(7L, 1L, LocalDate.of(2026, 3, 2), 1, 7, Mesocycle.Status.ACTIVE));

        mvc.perform(post("/api/v1/mesocycles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"planId\":1,\"startDate\":\"2026-03-02\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void create_missingStartDate_shouldBe400() throws Exception {
        mvc.perform(post("/api/v1/mesocycles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"planId\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(header().exists(RequestIdFilter.HEADER));

        verify(mesocycleService, never()).create(anyLong(), any());
    }

    @Test
    void conflict_shouldBe409_withEchoedRequestId() throws Exception {
        Mockito.when(mesocycleService.create(anyLong(), any()))
                .thenThrow(new ConflictException("An active mesocycle already exists for plan 1"));

        mvc.perform(post("/api/v1/mesocycles")
                        .header(RequestIdFilter.HEADER, "rid-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"planId\":1,\"startDate\":\"2026-03-02\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("CONFLICT"))
                .andExpect(jsonPath("$.requestId").value("rid-123"));
    }

    @Test
    void complete_cancelledMesocycle_shouldBe400() throws Exception {
        Mockito.when(mesocycleService.complete(3L))
                .thenThrow(new ValidationException("Mesocycle 3 is not active (CANCELLED)"));

        mvc.perform(put("/api/v1/mesocycles/3/complete"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Mesocycle 3 is not active (CANCELLED)"));
    }

    @Test
    void start_completedWorkout_shouldBe400InvalidTransition() throws Exception {
        Mockito.when(workoutService.start(5L))
                .thenThrow(new InvalidTransitionException("workout", Workout.Status.COMPLETED, "start"));

        mvc.perform(put("/api/v1/workouts/5/start"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TRANSITION"));
    }

    @Test
    void unknownWorkout_shouldBe404() throws Exception {
        Mockito.when(workoutService.getById(99L)).thenThrow(new NotFoundException("Workout", 99L));

        mvc.perform(get("/api/v1/workouts/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("WORKOUT_NOT_FOUND"));
    }

    @Test
    void staleWrite_shouldBe409() throws Exception {
        Mockito.when(workoutService.complete(5L))
                .thenThrow(new ObjectOptimisticLockingFailureException(Workout.class, 5L));

        mvc.perform(put("/api/v1/workouts/5/complete"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("CONFLICT"));
    }

    @Test
    void logSet_negativeReps_shouldBe400BeforeService() throws Exception {
        mvc.perform(put("/api/v1/workout-sets/1/log")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actualReps\":-1,\"actualWeight\":100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verify(setService, never()).logSet(anyLong(), any(), any());
    }

    @Test
    void today_withNothingScheduled_shouldBe204() throws Exception {
        Mockito.when(workoutService.today()).thenReturn(Optional.empty());

        mvc.perform(get("/api/v1/workouts/today"))
                .andExpect(status().isNoContent());
    }

    @Test
    void listWorkouts_withoutMesocycleId_shouldBe400() throws Exception {
        mvc.perform(get("/api/v1/workouts"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void info_shouldAnswerWithRequestIdHeader() throws Exception {
        mvc.perform(get("/api/info").header(RequestIdFilter.HEADER, "abc"))
                .andExpect(status().isOk())
                .andExpect(header().string(RequestIdFilter.HEADER, "abc"))
                .andExpect(jsonPath("$.message").value("Lifting backend is up!"));
    }

    @Test
    void info_shouldReportTrainingDateAndProgressionSettings() throws Exception {
        mvc.perform(get("/api/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trainingDate").value("2026-03-04"))
                .andExpect(jsonPath("$.failureThreshold").value(2))
                .andExpect(jsonPath("$.deloadEveryWeeks").value(0));
    }

    @Test
    void exerciseHistory_unknownExercise_shouldBe404() throws Exception {
        Mockito.when(historyService.getHistory(42L)).thenThrow(new NotFoundException("Exercise", 42L));

        mvc.perform(get("/api/v1/exercises/42/history"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("EXERCISE_NOT_FOUND"));
    }

    @Test
    void addPlanExercise_shouldBe201WithSyncOutcome() throws Exception {
        Mockito.when(planExerciseService.add(eq(1L), eq(2L), any(AddPlanExerciseRequest.class))).thenReturn(
                new PlanExerciseChangeResponse(
                        new PlanExerciseDto(30L, 2L, 5L, 3, 10, 100.0, 8, 12, 90, 1),
                        new PlanSyncResult(1, 3, 0, 0, 0, List.of())));

        mvc.perform(post("/api/v1/plans/1/days/2/exercises")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"exerciseId\":5,\"weight\":100}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.exercise.id").value(30))
                .andExpect(jsonPath("$.sync.addedSetsCount").value(3));
    }

    @Test
    void addPlanExercise_withoutExerciseId_shouldBe400() throws Exception {
        mvc.perform(post("/api/v1/plans/1/days/2/exercises")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sets\":3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verify(planExerciseService, never()).add(anyLong(), anyLong(), any());
    }
}
