package app.scoliofit.core.adherence.controller.dto;

import app.scoliofit.core.adherence.domain.RoutineSection;
import jakarta.validation.constraints.NotBlank;

public record RecordExerciseRequest(
        @NotBlank String exerciseId,
        RoutineSection section
) {
}
