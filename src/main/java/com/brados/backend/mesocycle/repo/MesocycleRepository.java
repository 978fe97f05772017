package com.brados.backend.mesocycle.repo;

import com.brados.backend.mesocycle.entity.Mesocycle;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface MesocycleRepository extends JpaRepository<Mesocycle, Long> {

    List<Mesocycle> findByStatus(Mesocycle.Status status);

    Optional<Mesocycle> findFirstByPlanIdAndStatus(Long planId, Mesocycle.Status status);

    boolean existsByPlanIdAndStatus(Long planId, Mesocycle.Status status);

    List<Mesocycle> findAllByOrderByStartDateDescIdDesc();
}
