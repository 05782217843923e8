package github.sarthakdev143.production_planner.dto;

import github.sarthakdev143.production_planner.model.validation.DanglingReference;
import github.sarthakdev143.production_planner.model.validation.TimelineViolation;
import github.sarthakdev143.production_planner.model.validation.ValidationReport;

import java.util.List;
import java.util.Set;

public record ManifestValidationResponse(
        boolean valid,
        List<TimelineViolation> timelineViolations,
        Set<DanglingReference> danglingReferences,
        List<String> cycle,
        List<String> messages) {

    public static ManifestValidationResponse from(ValidationReport report) {
        return new ManifestValidationResponse(
                report.valid(),
                report.timelineViolations(),
                report.danglingReferences(),
                report.cycle(),
                report.describe());
    }
}
