package com.brados.backend.mesocycle.controller;

import com.brados.backend.mesocycle.dto.AdvanceWeekResponse;
import com.brados.backend.mesocycle.dto.CreateMesocycleRequest;
import com.brados.backend.mesocycle.dto.MesocycleDetailDto;
import com.brados.backend.mesocycle.dto.MesocycleDto;
import com.brados.backend.mesocycle.service.MesocycleService;
import com.brados.backend.mesocycle.service.PlanModificationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Mesocycle", description = "Training blocks: create / complete / cancel / advance week")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/mesocycles")
public class MesocycleController {

    private final MesocycleService mesocycleService;
    private final PlanModificationService planModification;

    @GetMapping
    public List<MesocycleDto> list() {
        return mesocycleService.list();
    }

    /** 204 when no block is running. */
    @GetMapping("/active")
    public ResponseEntity<MesocycleDetailDto> active() {
        return mesocycleService.getActive()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}")
    public MesocycleDetailDto get(@PathVariable Long id) {
        return mesocycleService.getById(id);
    }

    @PostMapping
    public ResponseEntity<MesocycleDto> create(@Valid @RequestBody CreateMesocycleRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mesocycleService.create(req.planId(), req.startDate()));
    }

    @PutMapping("/{id}/complete")
    public MesocycleDto complete(@PathVariable Long id) {
        return mesocycleService.complete(id);
    }

    @PutMapping("/{id}/cancel")
    public MesocycleDto cancel(@PathVariable Long id) {
        return mesocycleService.cancel(id);
    }

    @PutMapping("/{id}/advance-week")
    public AdvanceWeekResponse advanceWeek(@PathVariable Long id) {
        return AdvanceWeekResponse.from(planModification.advanceWeek(id));
    }
}
