package app.scoliofit.core.adherence.engine;

import app.scoliofit.core.adherence.domain.DayLog;
import app.scoliofit.core.adherence.domain.ExerciseCompletion;
import app.scoliofit.core.adherence.domain.GamificationState;
import app.scoliofit.core.adherence.domain.NotificationSettings;
import app.scoliofit.core.adherence.domain.NotificationSettingsPatch;
import app.scoliofit.core.adherence.domain.RoutineSection;
import app.scoliofit.core.adherence.domain.StreakData;
import app.scoliofit.core.adherence.domain.WeekLog;
import app.scoliofit.core.adherence.util.WeekCalendar;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * State transitions of the weekly streak model.
 * <p>
 * Every operation takes a {@link GamificationState} and returns the resulting state without
 * modifying its argument; when nothing changes the same instance is returned. The only source
 * of non-determinism is the {@link WeekCalendar} clock. Persisting results is up to the caller.
 */
@Component
public class StreakEngine {

    public static final int DEFAULT_GOAL_DAYS = 4;
    public static final int MIN_GOAL_DAYS = 1;
    public static final int MAX_GOAL_DAYS = 7;
    public static final int HISTORY_LIMIT = 12;
    public static final String DEFAULT_REMINDER_TIME = "09:00";

    private final WeekCalendar calendar;

    public StreakEngine(WeekCalendar calendar) {
        this.calendar = calendar;
    }

    public GamificationState initialize() {
        return initialize(DEFAULT_GOAL_DAYS);
    }

    public GamificationState initialize(int goalDays) {
        return new GamificationState(
                StreakData.initial(),
                WeekLog.open(calendar.currentWeekStart(), clampGoal(goalDays)),
                NotificationSettings.defaults(DEFAULT_REMINDER_TIME),
                calendar.now()
        );
    }

    public GamificationState markDayComplete(GamificationState state) {
        LocalDate today = calendar.today();
        WeekLog week = state.currentWeek();
        Optional<DayLog> existing = week.findDay(today);
        if (existing.isPresent() && existing.get().routineCompleted()) {
            return state;
        }
        DayLog completed = existing.orElseGet(() -> DayLog.empty(today)).withRoutineCompleted(true);
        return state.withCurrentWeek(week.withDayLog(completed));
    }

    public GamificationState unmarkDayComplete(GamificationState state) {
        WeekLog week = state.currentWeek();
        WeekLog updated = week.findDay(calendar.today())
                .map(log -> week.withDayLog(log.withRoutineCompleted(false)))
                .orElseGet(week::withRecountedProgress);
        return state.withCurrentWeek(updated);
    }

    public GamificationState recordExerciseCompletion(GamificationState state,
                                                      String exerciseId,
                                                      RoutineSection section) {
        if (exerciseId == null || exerciseId.isBlank()) {
            return state;
        }
        LocalDate today = calendar.today();
        WeekLog week = state.currentWeek();
        ExerciseCompletion completion = new ExerciseCompletion(
                UUID.randomUUID().toString(),
                exerciseId.trim(),
                calendar.now(),
                section
        );
        DayLog log = week.findDay(today).orElseGet(() -> DayLog.empty(today)).withExercise(completion);
        return state.withCurrentWeek(week.withDayLog(log));
    }

    public boolean isTodayComplete(GamificationState state) {
        return state.currentWeek().findDay(calendar.today())
                .map(DayLog::routineCompleted)
                .orElse(false);
    }

    /**
     * @return seven flags, Monday first, set for each completed day of the current week
     */
    public List<Boolean> getWeekCompletionStatus(GamificationState state) {
        Boolean[] days = new Boolean[7];
        Arrays.fill(days, Boolean.FALSE);
        for (DayLog log : state.currentWeek().dayLogs()) {
            if (log.routineCompleted() && log.date() != null) {
                days[WeekCalendar.dayOfWeekIndex(log.date())] = Boolean.TRUE;
            }
        }
        return List.of(days);
    }

    /**
     * Brings the state up to the week containing now, archiving and resolving every week
     * that ended in between, oldest first. Skipped weeks are resolved one by one with the
     * goal of the stored week, so a single freeze can rescue at most the first missed one.
     */
    public GamificationState processWeekTransition(GamificationState state) {
        LocalDate presentWeekStart = calendar.currentWeekStart();
        WeekLog stored = state.currentWeek();
        if (!stored.weekStart().isBefore(presentWeekStart)) {
            // same week, or a stored week in the future after a clock change
            return state;
        }

        StreakData streak = state.streakData();
        Instant now = calendar.now();
        List<WeekLog> history = new ArrayList<>(streak.weekHistory());
        int currentStreak = streak.currentStreak();
        int longestStreak = streak.longestStreak();
        LocalDate lastWeekCompleted = streak.lastWeekCompleted();
        boolean freezeAvailable = streak.streakFreezeAvailable();
        Instant freezeUsedAt = streak.streakFreezeUsedThisMonth();

        WeekLog week = stored;
        while (calendar.hasWeekEnded(week.weekStart()) && !week.weekStart().equals(presentWeekStart)) {
            history.add(week.archived());

            if (week.goalMet()) {
                currentStreak++;
                lastWeekCompleted = week.weekStart();
                longestStreak = Math.max(longestStreak, currentStreak);
            } else if (freezeAvailable && currentStreak > 0) {
                freezeAvailable = false;
                freezeUsedAt = now;
            } else {
                currentStreak = 0;
            }

            week = WeekLog.open(week.weekStart().plusWeeks(1), stored.goalDays());
        }

        if (history.size() > HISTORY_LIMIT) {
            history = new ArrayList<>(history.subList(history.size() - HISTORY_LIMIT, history.size()));
        }

        StreakData resolved = new StreakData(
                currentStreak,
                longestStreak,
                lastWeekCompleted,
                freezeAvailable,
                freezeUsedAt,
                history
        );
        return state
                .withStreakData(resolved)
                .withCurrentWeek(WeekLog.open(presentWeekStart, stored.goalDays()));
    }

    public GamificationState updateWeeklyGoal(GamificationState state, int goalDays) {
        return state.withCurrentWeek(state.currentWeek().withGoalDays(clampGoal(goalDays)));
    }

    public GamificationState updateNotificationSettings(GamificationState state, NotificationSettingsPatch patch) {
        if (patch == null) {
            return state;
        }
        return state.withNotifications(patch.applyTo(state.notifications()));
    }

    public boolean canUseStreakFreeze(GamificationState state) {
        StreakData streak = state.streakData();
        return streak.streakFreezeAvailable() && !calendar.isCurrentMonth(streak.streakFreezeUsedThisMonth());
    }

    public GamificationState useStreakFreeze(GamificationState state) {
        if (!canUseStreakFreeze(state)) {
            return state;
        }
        return state.withStreakData(state.streakData().withFreeze(false, calendar.now()));
    }

    /**
     * Grants the monthly freeze again once its last use falls outside the current month.
     */
    public GamificationState refreshFreezeQuota(GamificationState state) {
        Instant usedAt = state.streakData().streakFreezeUsedThisMonth();
        if (usedAt == null || calendar.isCurrentMonth(usedAt)) {
            return state;
        }
        return state.withStreakData(state.streakData().withFreeze(true, null));
    }

    public static int clampGoal(int goalDays) {
        return Math.max(MIN_GOAL_DAYS, Math.min(MAX_GOAL_DAYS, goalDays));
    }

    public static String streakLabel(int streak) {
        if (streak <= 0) {
            return "Start your streak!";
        }
        if (streak == 1) {
            return "1 week streak";
        }
        return streak + " week streak";
    }
}
