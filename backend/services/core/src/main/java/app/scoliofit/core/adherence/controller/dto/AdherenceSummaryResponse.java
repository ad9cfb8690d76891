package app.scoliofit.core.adherence.controller.dto;

import app.scoliofit.core.adherence.domain.NotificationSettings;
import app.scoliofit.core.adherence.domain.WeekLog;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record AdherenceSummaryResponse(
        Streak streak,
        Freeze freeze,
        CurrentWeek currentWeek,
        NotificationSettings notifications,
        List<WeekLog> weekHistory,
        Instant lastUpdated
) {
    public record Streak(
            int currentStreak,
            int longestStreak,
            String label,
            LocalDate lastWeekCompleted
    ) {
    }

    public record Freeze(
            boolean available,
            Instant lastUsedAt
    ) {
    }

    public record CurrentWeek(
            LocalDate weekStart,
            LocalDate weekEnd,
            int goalDays,
            int daysExercised,
            boolean goalMet,
            List<Boolean> completedDays,
            boolean todayComplete,
            int todayIndex
    ) {
    }
}
