package app.scoliofit.core.adherence.store;

import app.scoliofit.core.adherence.entity.StateSnapshotEntity;
import app.scoliofit.core.adherence.repository.StateSnapshotRepository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

public class JpaStateStore implements StateStore {

    private final StateSnapshotRepository repository;
    private final Clock clock;

    public JpaStateStore(StateSnapshotRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        return repository.findById(key).map(StateSnapshotEntity::getPayload);
    }

    @Override
    @Transactional
    public void set(String key, String value) {
        StateSnapshotEntity entity = repository.findById(key).orElseGet(() -> {
            StateSnapshotEntity created = new StateSnapshotEntity();
            created.setStorageKey(key);
            return created;
        });
        entity.setPayload(value);
        entity.setUpdatedAt(clock.instant());
        repository.save(entity);
    }
}
