package app.scoliofit.core.adherence.domain;

import java.time.Instant;

public record ExerciseCompletion(String id,
                                 String exerciseId,
                                 Instant completedAt,
                                 RoutineSection routineSection) {
}
