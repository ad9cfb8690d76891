package app.scoliofit.core.adherence.service;

import app.scoliofit.core.adherence.domain.NotificationPermission;
import app.scoliofit.core.adherence.domain.NotificationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Decides whether today's exercise reminder is due. A reminder is due once per day, from
 * two minutes before the configured time onwards, while reminders are enabled and permitted.
 */
@Component
public class ReminderPolicy {
    private static final Logger log = LoggerFactory.getLogger(ReminderPolicy.class);
    private static final Duration WINDOW = Duration.ofMinutes(2);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    public boolean shouldRemind(NotificationSettings settings, ZonedDateTime now, LocalDate lastShownDate) {
        if (settings == null || !settings.enabled() || settings.permission() != NotificationPermission.GRANTED) {
            return false;
        }
        if (now.toLocalDate().equals(lastShownDate)) {
            return false;
        }

        LocalTime reminderTime = parseTime(settings.reminderTime());
        if (reminderTime == null) {
            return false;
        }
        ZonedDateTime scheduled = now.with(reminderTime);
        boolean withinWindow = Duration.between(scheduled, now).abs().compareTo(WINDOW) < 0;
        return withinWindow || !now.isBefore(scheduled);
    }

    private static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim(), TIME_FORMAT);
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring unparsable reminder time '{}'", value);
            return null;
        }
    }
}
