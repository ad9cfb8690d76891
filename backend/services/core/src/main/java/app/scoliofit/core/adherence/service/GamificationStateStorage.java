package app.scoliofit.core.adherence.service;

import app.scoliofit.core.adherence.domain.DayLog;
import app.scoliofit.core.adherence.domain.GamificationState;
import app.scoliofit.core.adherence.domain.WeekLog;
import app.scoliofit.core.adherence.engine.StreakEngine;
import app.scoliofit.core.adherence.store.StateStore;
import app.scoliofit.core.adherence.util.WeekCalendar;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads and writes {@link GamificationState} snapshots as JSON through a {@link StateStore}.
 * Unreadable snapshots load as empty so the caller can start over with a fresh state.
 */
@Component
public class GamificationStateStorage {
    private static final Logger log = LoggerFactory.getLogger(GamificationStateStorage.class);

    private final StateStore store;
    private final StreakEngine engine;
    private final WeekCalendar calendar;
    private final ObjectMapper mapper;

    public GamificationStateStorage(StateStore store,
                                    StreakEngine engine,
                                    WeekCalendar calendar,
                                    ObjectMapper objectMapper) {
        this.store = store;
        this.engine = engine;
        this.calendar = calendar;
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Optional<GamificationState> load(String key) {
        Optional<String> raw = store.get(key);
        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }

        GamificationState state;
        try {
            state = mapper.readValue(raw.get(), GamificationState.class);
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable gamification snapshot key={} error={}", key, ex.getOriginalMessage());
            return Optional.empty();
        }
        if (!isComplete(state)) {
            log.warn("Incomplete gamification snapshot key={}", key);
            return Optional.empty();
        }
        return Optional.of(engine.refreshFreezeQuota(state));
    }

    /**
     * Stamps {@code lastUpdated}, overwrites the snapshot under {@code key} and returns the stamped state.
     */
    public GamificationState save(String key, GamificationState state) {
        GamificationState stamped = state.withLastUpdated(calendar.now());
        try {
            store.set(key, mapper.writeValueAsString(stamped));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize gamification state for " + key, ex);
        }
        return stamped;
    }

    private static boolean isComplete(GamificationState state) {
        if (state == null || state.streakData() == null || state.notifications() == null) {
            return false;
        }
        WeekLog week = state.currentWeek();
        if (week == null || week.weekStart() == null || !hasDatedDays(week)) {
            return false;
        }
        if (week.goalDays() != StreakEngine.clampGoal(week.goalDays())) {
            return false;
        }
        for (WeekLog archived : state.streakData().weekHistory()) {
            if (archived == null || archived.weekStart() == null || !hasDatedDays(archived)) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasDatedDays(WeekLog week) {
        for (DayLog day : week.dayLogs()) {
            if (day == null || day.date() == null) {
                return false;
            }
        }
        return true;
    }
}
