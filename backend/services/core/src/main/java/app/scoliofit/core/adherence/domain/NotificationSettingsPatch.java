package app.scoliofit.core.adherence.domain;

/**
 * Partial update of {@link NotificationSettings}; {@code null} fields are left untouched.
 */
public record NotificationSettingsPatch(Boolean enabled,
                                        String reminderTime,
                                        NotificationPermission permission) {

    public NotificationSettings applyTo(NotificationSettings current) {
        return new NotificationSettings(
                enabled != null ? enabled : current.enabled(),
                reminderTime != null ? reminderTime : current.reminderTime(),
                permission != null ? permission : current.permission()
        );
    }
}
