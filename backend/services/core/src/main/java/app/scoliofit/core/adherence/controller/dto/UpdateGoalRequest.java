package app.scoliofit.core.adherence.controller.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateGoalRequest(
        @NotNull Integer goalDays
) {
}
