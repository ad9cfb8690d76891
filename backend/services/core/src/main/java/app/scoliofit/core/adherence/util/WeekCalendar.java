package app.scoliofit.core.adherence.util;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;

/**
 * Week and month arithmetic for adherence tracking. Weeks run Monday through Sunday;
 * a week has ended once the following Monday has started in the clock's zone.
 */
@Component
public class WeekCalendar {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter MONTH_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM");

    private final Clock clock;

    public WeekCalendar(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public ZonedDateTime zonedNow() {
        return ZonedDateTime.now(clock);
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate currentWeekStart() {
        return weekStart(today());
    }

    public static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static LocalDate weekEnd(LocalDate date) {
        return date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
    }

    /**
     * @return 0 for Monday through 6 for Sunday
     */
    public static int dayOfWeekIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() - 1;
    }

    public int todayIndex() {
        return dayOfWeekIndex(today());
    }

    public boolean hasWeekEnded(LocalDate weekStart) {
        Instant end = weekStart.plusWeeks(1).atStartOfDay(clock.getZone()).toInstant();
        return !clock.instant().isBefore(end);
    }

    public YearMonth currentMonth() {
        return YearMonth.now(clock);
    }

    public String currentMonthKey() {
        return currentMonth().format(MONTH_FORMATTER);
    }

    public boolean isCurrentMonth(Instant timestamp) {
        if (timestamp == null) {
            return false;
        }
        return YearMonth.from(timestamp.atZone(clock.getZone())).equals(currentMonth());
    }

    public static String format(LocalDate date) {
        return date.format(DATE_FORMATTER);
    }
}
