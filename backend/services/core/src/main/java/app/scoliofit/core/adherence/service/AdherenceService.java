package app.scoliofit.core.adherence.service;

import app.scoliofit.core.adherence.config.AdherenceProps;
import app.scoliofit.core.adherence.controller.dto.AdherenceSummaryResponse;
import app.scoliofit.core.adherence.controller.dto.ReminderClaimResponse;
import app.scoliofit.core.adherence.domain.GamificationState;
import app.scoliofit.core.adherence.domain.NotificationSettingsPatch;
import app.scoliofit.core.adherence.domain.RoutineSection;
import app.scoliofit.core.adherence.domain.StreakData;
import app.scoliofit.core.adherence.domain.WeekLog;
import app.scoliofit.core.adherence.engine.StreakEngine;
import app.scoliofit.core.adherence.store.StateStore;
import app.scoliofit.core.adherence.util.WeekCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Per-user adherence session: every call loads the snapshot (or starts a fresh one), catches
 * it up to the current week, applies the requested change and persists the result.
 */
@Service
public class AdherenceService {
    private static final Logger log = LoggerFactory.getLogger(AdherenceService.class);

    static final String STATE_KEY_PREFIX = "gamificationState:";
    static final String REMINDER_KEY_PREFIX = "lastReminderShown:";

    private final GamificationStateStorage storage;
    private final StateStore store;
    private final StreakEngine engine;
    private final ReminderPolicy reminderPolicy;
    private final WeekCalendar calendar;
    private final int defaultGoalDays;

    public AdherenceService(GamificationStateStorage storage,
                            StateStore store,
                            StreakEngine engine,
                            ReminderPolicy reminderPolicy,
                            WeekCalendar calendar,
                            AdherenceProps props) {
        this.storage = storage;
        this.store = store;
        this.engine = engine;
        this.reminderPolicy = reminderPolicy;
        this.calendar = calendar;
        this.defaultGoalDays = props == null || props.defaultGoalDays() == null
                ? StreakEngine.DEFAULT_GOAL_DAYS
                : StreakEngine.clampGoal(props.defaultGoalDays());
    }

    public AdherenceSummaryResponse getOrInitialize(UUID userId, Integer goalDays) {
        GamificationState state = loadCurrent(userId, goalDays);
        if (goalDays != null && goalDays != state.currentWeek().goalDays()) {
            state = engine.updateWeeklyGoal(state, goalDays);
        }
        return summarize(storage.save(stateKey(userId), state));
    }

    public AdherenceSummaryResponse markTodayComplete(UUID userId) {
        return mutate(userId, engine::markDayComplete);
    }

    public AdherenceSummaryResponse unmarkTodayComplete(UUID userId) {
        return mutate(userId, engine::unmarkDayComplete);
    }

    public AdherenceSummaryResponse recordExercise(UUID userId, String exerciseId, RoutineSection section) {
        return mutate(userId, state -> engine.recordExerciseCompletion(state, exerciseId, section));
    }

    public AdherenceSummaryResponse updateWeeklyGoal(UUID userId, int goalDays) {
        return mutate(userId, state -> engine.updateWeeklyGoal(state, goalDays));
    }

    public AdherenceSummaryResponse updateNotificationSettings(UUID userId, NotificationSettingsPatch patch) {
        return mutate(userId, state -> engine.updateNotificationSettings(state, patch));
    }

    public AdherenceSummaryResponse useStreakFreeze(UUID userId) {
        return mutate(userId, engine::useStreakFreeze);
    }

    /**
     * Marks today's reminder as shown when it is due, so that it fires at most once per day.
     */
    public ReminderClaimResponse claimReminder(UUID userId) {
        GamificationState state = loadCurrent(userId, null);
        String key = reminderKey(userId);
        ZonedDateTime now = calendar.zonedNow();
        LocalDate today = now.toLocalDate();

        if (!reminderPolicy.shouldRemind(state.notifications(), now, lastShown(key))) {
            return new ReminderClaimResponse(false, today);
        }
        store.set(key, WeekCalendar.format(today));
        return new ReminderClaimResponse(true, today);
    }

    public AdherenceSummaryResponse summarize(GamificationState state) {
        StreakData streak = state.streakData();
        WeekLog week = state.currentWeek();
        return new AdherenceSummaryResponse(
                new AdherenceSummaryResponse.Streak(
                        streak.currentStreak(),
                        streak.longestStreak(),
                        StreakEngine.streakLabel(streak.currentStreak()),
                        streak.lastWeekCompleted()
                ),
                new AdherenceSummaryResponse.Freeze(
                        engine.canUseStreakFreeze(state),
                        streak.streakFreezeUsedThisMonth()
                ),
                new AdherenceSummaryResponse.CurrentWeek(
                        week.weekStart(),
                        week.weekEnd(),
                        week.goalDays(),
                        week.daysExercised(),
                        week.goalMet(),
                        engine.getWeekCompletionStatus(state),
                        engine.isTodayComplete(state),
                        calendar.todayIndex()
                ),
                state.notifications(),
                streak.weekHistory(),
                state.lastUpdated()
        );
    }

    private AdherenceSummaryResponse mutate(UUID userId, UnaryOperator<GamificationState> operation) {
        GamificationState updated = operation.apply(loadCurrent(userId, null));
        return summarize(storage.save(stateKey(userId), updated));
    }

    private GamificationState loadCurrent(UUID userId, Integer goalDays) {
        Optional<GamificationState> loaded = storage.load(stateKey(userId));
        if (loaded.isEmpty()) {
            int goal = goalDays == null ? defaultGoalDays : goalDays;
            log.debug("Initializing adherence state userId={} goalDays={}", userId, goal);
            return engine.initialize(goal);
        }

        GamificationState stored = loaded.get();
        GamificationState caughtUp = engine.processWeekTransition(stored);
        if (caughtUp != stored) {
            log.info("Adherence week transition userId={} from={} to={} currentStreak={} freezeAvailable={}",
                    userId,
                    stored.currentWeek().weekStart(),
                    caughtUp.currentWeek().weekStart(),
                    caughtUp.streakData().currentStreak(),
                    caughtUp.streakData().streakFreezeAvailable());
        }
        return caughtUp;
    }

    private LocalDate lastShown(String key) {
        Optional<String> raw = store.get(key);
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.get().trim());
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring unreadable reminder marker key={} value={}", key, raw.get());
            return null;
        }
    }

    private static String stateKey(UUID userId) {
        return STATE_KEY_PREFIX + userId;
    }

    private static String reminderKey(UUID userId) {
        return REMINDER_KEY_PREFIX + userId;
    }
}
