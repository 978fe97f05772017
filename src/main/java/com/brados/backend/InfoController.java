package com.brados.backend;

import com.brados.backend.progression.config.ProgressionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Liveness plus the server's view of "today" and the progression rules in force,
 * so a client can tell which day {@code /workouts/today} resolves to.
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api")
public class InfoController {

    private final Clock clock;
    private final ProgressionProperties progression;

    public record Info(
            String message,
            String serverTime,
            LocalDate trainingDate,
            int failureThreshold,
            int deloadEveryWeeks
    ) {}

    @GetMapping("/info")
    public Info info() {
        return new Info("Lifting backend is up!",
                OffsetDateTime.now(clock).toString(),
                LocalDate.now(clock),
                progression.getFailureThreshold(),
                progression.getDeloadEveryWeeks());
    }
}
