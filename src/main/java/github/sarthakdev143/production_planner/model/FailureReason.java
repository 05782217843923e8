package github.sarthakdev143.production_planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Machine-readable cause attached to every terminal failure of a query or asset.
 */
public enum FailureReason {
    REQUIRED_ASSET_FAILED,
    ANALYSIS_FAILED,
    ANALYSIS_TIMEOUT,
    CANCELLED,
    SYNTHESIS_FAILED,
    VALIDATION_FAILED;

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
