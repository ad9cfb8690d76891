package app.scoliofit.core.adherence.controller.dto;

import java.time.LocalDate;

public record ReminderClaimResponse(
        boolean due,
        LocalDate date
) {
}
