package app.scoliofit.core.adherence.controller.dto;

import app.scoliofit.core.adherence.domain.NotificationPermission;
import app.scoliofit.core.adherence.domain.NotificationSettingsPatch;

public record UpdateNotificationsRequest(
        Boolean enabled,
        String reminderTime,
        NotificationPermission permission
) {
    public NotificationSettingsPatch toPatch() {
        return new NotificationSettingsPatch(enabled, reminderTime, permission);
    }
}
