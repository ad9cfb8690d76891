package app.scoliofit.core.adherence.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Running streak counters plus the bounded history of archived weeks.
 *
 * @param lastWeekCompleted         week start of the most recent goal-met week
 * @param streakFreezeUsedThisMonth when the monthly freeze was last consumed, {@code null} if never
 */
public record StreakData(int currentStreak,
                         int longestStreak,
                         LocalDate lastWeekCompleted,
                         boolean streakFreezeAvailable,
                         Instant streakFreezeUsedThisMonth,
                         List<WeekLog> weekHistory) {

    public StreakData {
        weekHistory = weekHistory == null ? List.of() : List.copyOf(weekHistory);
    }

    public static StreakData initial() {
        return new StreakData(0, 0, null, true, null, List.of());
    }

    public StreakData withFreeze(boolean available, Instant usedAt) {
        return new StreakData(currentStreak, longestStreak, lastWeekCompleted, available, usedAt, weekHistory);
    }
}
