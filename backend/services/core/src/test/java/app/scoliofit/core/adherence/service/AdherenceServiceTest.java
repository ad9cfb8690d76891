package app.scoliofit.core.adherence.service;

import app.scoliofit.core.adherence.config.AdherenceProps;
import app.scoliofit.core.adherence.controller.dto.AdherenceSummaryResponse;
import app.scoliofit.core.adherence.controller.dto.ReminderClaimResponse;
import app.scoliofit.core.adherence.domain.GamificationState;
import app.scoliofit.core.adherence.domain.NotificationPermission;
import app.scoliofit.core.adherence.domain.NotificationSettingsPatch;
import app.scoliofit.core.adherence.domain.RoutineSection;
import app.scoliofit.core.adherence.engine.StreakEngine;
import app.scoliofit.core.adherence.store.InMemoryStateStore;
import app.scoliofit.core.adherence.store.StateStore;
import app.scoliofit.core.adherence.util.WeekCalendar;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdherenceServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AdherenceProps PROPS = new AdherenceProps("UTC", 4, "memory");

    @Mock
    StateStore mockStore;

    private final InMemoryStateStore store = new InMemoryStateStore();
    private final UUID userId = UUID.randomUUID();

    private static AdherenceService serviceAt(String instant, StateStore store) {
        WeekCalendar calendar = new WeekCalendar(Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
        StreakEngine engine = new StreakEngine(calendar);
        GamificationStateStorage storage = new GamificationStateStorage(store, engine, calendar, MAPPER);
        return new AdherenceService(storage, store, engine, new ReminderPolicy(), calendar, PROPS);
    }

    private AdherenceService serviceAt(String instant) {
        return serviceAt(instant, store);
    }

    @Test
    void getOrInitialize_createsAndPersistsFreshState() {
        AdherenceSummaryResponse summary = serviceAt("2026-10-21T10:00:00Z").getOrInitialize(userId, null);

        assertThat(summary.currentWeek().weekStart()).isEqualTo(LocalDate.of(2026, 10, 19));
        assertThat(summary.currentWeek().goalDays()).isEqualTo(4);
        assertThat(summary.currentWeek().completedDays()).hasSize(7).containsOnly(false);
        assertThat(summary.currentWeek().todayIndex()).isEqualTo(2);
        assertThat(summary.streak().label()).isEqualTo("Start your streak!");
        assertThat(summary.freeze().available()).isTrue();
        assertThat(summary.lastUpdated()).isEqualTo(Instant.parse("2026-10-21T10:00:00Z"));
        assertThat(store.get(AdherenceService.STATE_KEY_PREFIX + userId)).isPresent();
    }

    @Test
    void getOrInitialize_appliesRequestedGoal() {
        serviceAt("2026-10-21T10:00:00Z").getOrInitialize(userId, 5);
        AdherenceSummaryResponse changed = serviceAt("2026-10-21T11:00:00Z").getOrInitialize(userId, 9);

        assertThat(changed.currentWeek().goalDays()).isEqualTo(7);
    }

    @Test
    void markTodayComplete_persistsAcrossSessions() {
        serviceAt("2026-10-19T08:00:00Z").markTodayComplete(userId);
        serviceAt("2026-10-20T08:00:00Z").markTodayComplete(userId);
        AdherenceSummaryResponse repeated = serviceAt("2026-10-20T09:00:00Z").markTodayComplete(userId);

        assertThat(repeated.currentWeek().daysExercised()).isEqualTo(2);
        assertThat(repeated.currentWeek().todayComplete()).isTrue();
        assertThat(repeated.currentWeek().completedDays())
                .containsExactly(true, true, false, false, false, false, false);
    }

    @Test
    void unmarkTodayComplete_undoesTodayOnly() {
        serviceAt("2026-10-19T08:00:00Z").markTodayComplete(userId);
        serviceAt("2026-10-20T08:00:00Z").markTodayComplete(userId);

        AdherenceSummaryResponse summary = serviceAt("2026-10-20T21:00:00Z").unmarkTodayComplete(userId);

        assertThat(summary.currentWeek().daysExercised()).isEqualTo(1);
        assertThat(summary.currentWeek().todayComplete()).isFalse();
    }

    @Test
    void reopeningAfterWeeksAway_catchesUpBeforeServing() {
        AdherenceService monday = serviceAt("2026-10-05T08:00:00Z");
        monday.getOrInitialize(userId, 2);
        monday.markTodayComplete(userId);
        serviceAt("2026-10-06T08:00:00Z").markTodayComplete(userId);

        AdherenceSummaryResponse summary = serviceAt("2026-10-28T08:00:00Z").getOrInitialize(userId, null);

        assertThat(summary.currentWeek().weekStart()).isEqualTo(LocalDate.of(2026, 10, 26));
        assertThat(summary.currentWeek().daysExercised()).isZero();
        assertThat(summary.weekHistory()).hasSize(3);
        // met, frozen, reset
        assertThat(summary.streak().currentStreak()).isZero();
        assertThat(summary.streak().longestStreak()).isEqualTo(1);
        assertThat(summary.streak().lastWeekCompleted()).isEqualTo(LocalDate.of(2026, 10, 5));
        assertThat(summary.freeze().available()).isFalse();
        assertThat(summary.freeze().lastUsedAt()).isEqualTo(Instant.parse("2026-10-28T08:00:00Z"));
    }

    @Test
    void recordExercise_keepsDayIncomplete() {
        AdherenceSummaryResponse summary = serviceAt("2026-10-21T10:00:00Z")
                .recordExercise(userId, "side-plank", RoutineSection.MAIN);

        assertThat(summary.currentWeek().daysExercised()).isZero();
        assertThat(summary.currentWeek().todayComplete()).isFalse();
    }

    @Test
    void useStreakFreeze_consumesMonthlyAllowance() {
        AdherenceSummaryResponse used = serviceAt("2026-10-21T10:00:00Z").useStreakFreeze(userId);
        AdherenceSummaryResponse stillUsed = serviceAt("2026-10-31T10:00:00Z").getOrInitialize(userId, null);
        AdherenceSummaryResponse renewed = serviceAt("2026-11-01T10:00:00Z").getOrInitialize(userId, null);

        assertThat(used.freeze().available()).isFalse();
        assertThat(stillUsed.freeze().available()).isFalse();
        assertThat(renewed.freeze().available()).isTrue();
        assertThat(renewed.freeze().lastUsedAt()).isNull();
    }

    @Test
    void claimReminder_firesOncePerDayWhenEnabled() {
        AdherenceService morning = serviceAt("2026-10-21T07:00:00Z");
        assertThat(morning.claimReminder(userId).due()).isFalse();

        morning.updateNotificationSettings(userId, new NotificationSettingsPatch(true, "08:00", NotificationPermission.GRANTED));
        assertThat(morning.claimReminder(userId).due()).isFalse();

        AdherenceService later = serviceAt("2026-10-21T08:01:00Z");
        ReminderClaimResponse first = later.claimReminder(userId);
        ReminderClaimResponse second = later.claimReminder(userId);

        assertThat(first.due()).isTrue();
        assertThat(first.date()).isEqualTo(LocalDate.of(2026, 10, 21));
        assertThat(second.due()).isFalse();
        assertThat(store.get(AdherenceService.REMINDER_KEY_PREFIX + userId)).contains("2026-10-21");
        assertThat(serviceAt("2026-10-22T09:00:00Z").claimReminder(userId).due()).isTrue();
    }

    @Test
    void corruptSnapshot_isReplacedWithFreshState() {
        String key = AdherenceService.STATE_KEY_PREFIX + userId;
        when(mockStore.get(key)).thenReturn(Optional.of("{\"streakData\":"));

        AdherenceSummaryResponse summary = serviceAt("2026-10-21T10:00:00Z", mockStore).getOrInitialize(userId, 3);

        assertThat(summary.currentWeek().goalDays()).isEqualTo(3);
        assertThat(summary.streak().currentStreak()).isZero();
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(mockStore).set(eq(key), payload.capture());
        assertThat(payload.getValue()).contains("\"goalDays\":3");
    }

    @Test
    void snapshotWithUndatedDay_isReplacedOnNextMutation() {
        String key = AdherenceService.STATE_KEY_PREFIX + userId;
        store.set(key, "{\"streakData\":{\"currentStreak\":3,\"longestStreak\":3,\"streakFreezeAvailable\":true,\"weekHistory\":[]},"
                + "\"currentWeek\":{\"weekStart\":\"2026-10-19\",\"weekEnd\":\"2026-10-25\",\"goalDays\":4,\"daysExercised\":1,"
                + "\"goalMet\":false,\"dayLogs\":[{\"routineCompleted\":true,\"completedExercises\":[]}]},"
                + "\"notifications\":{\"enabled\":false,\"reminderTime\":\"09:00\",\"permission\":\"default\"}}");

        AdherenceSummaryResponse summary = serviceAt("2026-10-21T10:00:00Z").markTodayComplete(userId);
        AdherenceSummaryResponse reloaded = serviceAt("2026-10-21T11:00:00Z").getOrInitialize(userId, null);

        assertThat(summary.currentWeek().daysExercised()).isEqualTo(1);
        assertThat(summary.streak().currentStreak()).isZero();
        assertThat(reloaded.currentWeek().todayComplete()).isTrue();
    }

    @Test
    void summarize_exposesStateFields() {
        AdherenceService service = serviceAt("2026-10-21T10:00:00Z");
        StreakEngine engine = new StreakEngine(new WeekCalendar(Clock.fixed(Instant.parse("2026-10-21T10:00:00Z"), ZoneOffset.UTC)));
        GamificationState state = engine.markDayComplete(engine.initialize(1));

        AdherenceSummaryResponse summary = service.summarize(state);

        assertThat(summary.currentWeek().goalMet()).isTrue();
        assertThat(summary.currentWeek().completedDays()).containsExactly(false, false, true, false, false, false, false);
        assertThat(summary.notifications()).isEqualTo(state.notifications());
        assertThat(summary.weekHistory()).isEmpty();
    }
}
