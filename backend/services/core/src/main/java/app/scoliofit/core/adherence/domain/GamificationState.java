package app.scoliofit.core.adherence.domain;

import java.time.Instant;

/**
 * Aggregate root of one user's adherence tracking. Instances are immutable; every
 * engine operation returns a new state.
 */
public record GamificationState(StreakData streakData,
                                WeekLog currentWeek,
                                NotificationSettings notifications,
                                Instant lastUpdated) {

    public GamificationState withStreakData(StreakData data) {
        return new GamificationState(data, currentWeek, notifications, lastUpdated);
    }

    public GamificationState withCurrentWeek(WeekLog week) {
        return new GamificationState(streakData, week, notifications, lastUpdated);
    }

    public GamificationState withNotifications(NotificationSettings settings) {
        return new GamificationState(streakData, currentWeek, settings, lastUpdated);
    }

    public GamificationState withLastUpdated(Instant timestamp) {
        return new GamificationState(streakData, currentWeek, notifications, timestamp);
    }
}
