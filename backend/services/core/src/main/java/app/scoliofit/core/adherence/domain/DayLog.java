package app.scoliofit.core.adherence.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record DayLog(LocalDate date,
                     List<ExerciseCompletion> completedExercises,
                     boolean routineCompleted) {

    public DayLog {
        completedExercises = completedExercises == null ? List.of() : List.copyOf(completedExercises);
    }

    public static DayLog empty(LocalDate date) {
        return new DayLog(date, List.of(), false);
    }

    public DayLog withRoutineCompleted(boolean completed) {
        return new DayLog(date, completedExercises, completed);
    }

    public DayLog withExercise(ExerciseCompletion completion) {
        List<ExerciseCompletion> exercises = new ArrayList<>(completedExercises);
        exercises.add(completion);
        return new DayLog(date, exercises, routineCompleted);
    }
}
