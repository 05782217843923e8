package github.sarthakdev143.production_planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobState {
    PENDING,
    READY,
    DISPATCHED,
    SUCCEEDED,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == BLOCKED;
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
