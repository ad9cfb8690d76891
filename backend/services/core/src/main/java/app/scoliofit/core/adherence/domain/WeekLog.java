package app.scoliofit.core.adherence.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One Monday-to-Sunday week of routine completions.
 * <p>
 * {@code daysExercised} and {@code goalMet} are stored alongside the day logs and are
 * recomputed by every mutation that touches them. Only the week held as
 * {@link GamificationState#currentWeek()} is {@link WeekStatus#CURRENT}; weeks in the
 * streak history are {@link WeekStatus#ARCHIVED} and never change again.
 */
public record WeekLog(LocalDate weekStart,
                      LocalDate weekEnd,
                      int goalDays,
                      int daysExercised,
                      boolean goalMet,
                      List<DayLog> dayLogs,
                      WeekStatus status) {

    public WeekLog {
        dayLogs = dayLogs == null ? List.of() : List.copyOf(dayLogs);
        status = status == null ? WeekStatus.CURRENT : status;
    }

    public static WeekLog open(LocalDate weekStart, int goalDays) {
        return new WeekLog(weekStart, weekStart.plusDays(6), goalDays, 0, false, List.of(), WeekStatus.CURRENT);
    }

    public Optional<DayLog> findDay(LocalDate date) {
        for (DayLog log : dayLogs) {
            if (date.equals(log.date())) {
                return Optional.of(log);
            }
        }
        return Optional.empty();
    }

    /**
     * Replaces the log with the same date (or appends it) and recounts progress.
     */
    public WeekLog withDayLog(DayLog dayLog) {
        List<DayLog> logs = new ArrayList<>(dayLogs.size() + 1);
        boolean replaced = false;
        for (DayLog existing : dayLogs) {
            if (!replaced && Objects.equals(existing.date(), dayLog.date())) {
                logs.add(dayLog);
                replaced = true;
            } else {
                logs.add(existing);
            }
        }
        if (!replaced) {
            logs.add(dayLog);
        }
        return recount(logs);
    }

    public WeekLog withRecountedProgress() {
        return recount(dayLogs);
    }

    // goalMet follows the recorded daysExercised, no recount
    public WeekLog withGoalDays(int goal) {
        return new WeekLog(weekStart, weekEnd, goal, daysExercised, daysExercised >= goal, dayLogs, status);
    }

    public WeekLog archived() {
        return new WeekLog(weekStart, weekEnd, goalDays, daysExercised, goalMet, dayLogs, WeekStatus.ARCHIVED);
    }

    private WeekLog recount(List<DayLog> logs) {
        int completed = 0;
        for (DayLog log : logs) {
            if (log.routineCompleted()) {
                completed++;
            }
        }
        return new WeekLog(weekStart, weekEnd, goalDays, completed, completed >= goalDays, logs, status);
    }
}
