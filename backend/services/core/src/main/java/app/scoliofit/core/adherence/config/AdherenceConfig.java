package app.scoliofit.core.adherence.config;

import app.scoliofit.core.adherence.repository.StateSnapshotRepository;
import app.scoliofit.core.adherence.store.InMemoryStateStore;
import app.scoliofit.core.adherence.store.JpaStateStore;
import app.scoliofit.core.adherence.store.StateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Configuration
public class AdherenceConfig {

    @Bean
    public Clock adherenceClock(AdherenceProps props) {
        String zone = props.timeZone();
        if (zone == null || zone.isBlank()) {
            return Clock.system(ZoneOffset.UTC);
        }
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.adherence", name = "store", havingValue = "jpa", matchIfMissing = true)
    public StateStore jpaStateStore(StateSnapshotRepository repository, Clock clock) {
        return new JpaStateStore(repository, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.adherence", name = "store", havingValue = "memory")
    public StateStore inMemoryStateStore() {
        return new InMemoryStateStore();
    }
}
