package app.scoliofit.core.adherence.domain;

/**
 * Reminder preferences. Stored here, interpreted by the reminder scheduling side.
 *
 * @param reminderTime local time of day as {@code HH:MM}, 24-hour clock
 */
public record NotificationSettings(boolean enabled,
                                   String reminderTime,
                                   NotificationPermission permission) {

    public NotificationSettings {
        permission = permission == null ? NotificationPermission.DEFAULT : permission;
    }

    public static NotificationSettings defaults(String reminderTime) {
        return new NotificationSettings(false, reminderTime, NotificationPermission.DEFAULT);
    }
}
