package app.scoliofit.core.adherence.domain;

public enum WeekStatus {
    CURRENT, ARCHIVED
}
