package github.sarthakdev143.production_planner.service.scheduling;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PlanStatus {
    RUNNING,
    SUCCEEDED,
    FAILED;

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
