package github.sarthakdev143.production_planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProgressMessageType {
    STATUS,
    ASSET_START,
    ASSET_PROGRESS,
    ASSET_COMPLETE,
    MERGE,
    FINAL,
    ERROR;

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
