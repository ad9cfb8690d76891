package app.scoliofit.core.adherence.repository;

import app.scoliofit.core.adherence.entity.StateSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StateSnapshotRepository extends JpaRepository<StateSnapshotEntity, String> {
}
