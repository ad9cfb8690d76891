package app.scoliofit.core.adherence.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RoutineSection {
    WARMUP, MAIN, COOLDOWN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RoutineSection fromString(String v) {
        if (v == null || v.isBlank()) {
            return null;
        }
        return RoutineSection.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
