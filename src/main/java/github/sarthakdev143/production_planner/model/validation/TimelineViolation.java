package github.sarthakdev143.production_planner.model.validation;

import java.util.List;

public record TimelineViolation(
        Kind kind,
        List<String> sceneIds,
        String message) {

    public enum Kind {
        NON_POSITIVE_DURATION,
        NEGATIVE_START,
        START_OUT_OF_ORDER,
        OVERLAP,
        DURATION_MISMATCH
    }

    public TimelineViolation {
        sceneIds = sceneIds == null ? List.of() : List.copyOf(sceneIds);
    }
}
