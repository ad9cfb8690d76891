package app.scoliofit.core.adherence.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Mirrors the platform notification permission as last reported by the client.
 */
public enum NotificationPermission {
    DEFAULT, GRANTED, DENIED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationPermission fromString(String v) {
        if (v == null || v.isBlank()) {
            return DEFAULT;
        }
        return NotificationPermission.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
