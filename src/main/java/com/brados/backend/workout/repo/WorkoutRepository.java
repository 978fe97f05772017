package com.brados.backend.workout.repo;

import com.brados.backend.workout.entity.Workout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.LocalDate;
import java.util.List;

public interface WorkoutRepository extends JpaRepository<Workout, Long> {

    List<Workout> findByMesocycleIdOrderByWeekNumberAscScheduledDateAsc(Long mesocycleId);

    List<Workout> findByMesocycleIdAndWeekNumber(Long mesocycleId, Integer weekNumber);

    @Query("""
        select w from Workout w
        where w.mesocycleId = ?1
          and w.scheduledDate = ?2
        order by w.id asc
        """)
    List<Workout> findScheduledOn(Long mesocycleId, LocalDate date);
}
