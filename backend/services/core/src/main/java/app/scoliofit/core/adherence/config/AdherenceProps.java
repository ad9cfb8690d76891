package app.scoliofit.core.adherence.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.adherence")
public record AdherenceProps(
        String timeZone,
        Integer defaultGoalDays,
        String store
) {
}
