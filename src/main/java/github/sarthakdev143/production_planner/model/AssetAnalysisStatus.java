package github.sarthakdev143.production_planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AssetAnalysisStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isFailure() {
        return this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
