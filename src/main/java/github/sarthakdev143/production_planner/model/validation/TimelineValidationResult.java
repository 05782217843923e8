package github.sarthakdev143.production_planner.model.validation;

import java.util.List;

public record TimelineValidationResult(
        boolean valid,
        List<TimelineViolation> violations) {

    public TimelineValidationResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static TimelineValidationResult of(List<TimelineViolation> violations) {
        return new TimelineValidationResult(violations.isEmpty(), violations);
    }
}
