package app.scoliofit.core.adherence.store;

import java.util.Optional;

/**
 * Synchronous string key-value storage holding serialized adherence snapshots.
 */
public interface StateStore {
    Optional<String> get(String key);

    void set(String key, String value);
}
