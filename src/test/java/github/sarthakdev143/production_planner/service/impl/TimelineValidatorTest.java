package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.model.manifest.ScenePlan;
import github.sarthakdev143.production_planner.model.validation.TimelineValidationResult;
import github.sarthakdev143.production_planner.model.validation.TimelineViolation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimelineValidatorTest {

    private final TimelineValidator validator = new TimelineValidator();

    @Test
    void validateAcceptsContiguousScenesMatchingDeclaredDuration() {
        TimelineValidationResult result = validator.validate(
                List.of(scene("s1", "0", "8"), scene("s2", "8", "44"), scene("s3", "52", "8")),
                new BigDecimal("60"));

        assertThat(result.valid()).isTrue();
        assertThat(result.violations()).isEmpty();
    }

    @Test
    void validateReportsOverlapAgainstPrecedingScene() {
        TimelineValidationResult result = validator.validate(
                List.of(scene("s1", "0", "8"), scene("s2", "8", "44"), scene("s3", "50", "8")),
                new BigDecimal("60"));

        assertThat(result.valid()).isFalse();
        assertThat(result.violations()).hasSize(1);
        TimelineViolation violation = result.violations().get(0);
        assertThat(violation.kind()).isEqualTo(TimelineViolation.Kind.OVERLAP);
        assertThat(violation.sceneIds()).containsExactly("s2", "s3");
        assertThat(violation.message()).isEqualTo("scene s3 [50, 58) overlaps scene s2 [8, 52).");
    }

    @Test
    void validateAllowsScenesThatOnlyTouch() {
        TimelineValidationResult result = validator.validate(
                List.of(scene("s1", "0", "7.5"), scene("s2", "7.5", "2.5")),
                new BigDecimal("10.0"));

        assertThat(result.valid()).isTrue();
    }

    @Test
    void validateComparesTotalDurationExactly() {
        TimelineValidationResult result = validator.validate(
                List.of(scene("s1", "0", "0.1"), scene("s2", "0.1", "0.2")),
                new BigDecimal("0.3"));

        assertThat(result.valid()).isTrue();

        TimelineValidationResult mismatch = validator.validate(
                List.of(scene("s1", "0", "0.1"), scene("s2", "0.1", "0.2")),
                new BigDecimal("0.31"));

        assertThat(mismatch.violations())
                .extracting(TimelineViolation::kind)
                .containsExactly(TimelineViolation.Kind.DURATION_MISMATCH);
        assertThat(mismatch.violations().get(0).message())
                .isEqualTo("scene durations sum to 0.3 seconds but metadata.durationSeconds is 0.31.");
    }

    @Test
    void validateReportsNonPositiveDurationAndNegativeStart() {
        TimelineValidationResult result = validator.validate(
                List.of(scene("s1", "-1", "5"), scene("s2", "4", "0")),
                new BigDecimal("5"));

        assertThat(result.violations())
                .extracting(TimelineViolation::kind)
                .containsExactlyInAnyOrder(
                        TimelineViolation.Kind.NEGATIVE_START,
                        TimelineViolation.Kind.NON_POSITIVE_DURATION);
    }

    @Test
    void validateReportsScenesOutOfOrderAndTheirOverlap() {
        TimelineValidationResult result = validator.validate(
                List.of(scene("s1", "10", "10"), scene("s2", "5", "10")),
                new BigDecimal("20"));

        assertThat(result.violations())
                .extracting(TimelineViolation::kind)
                .containsExactly(TimelineViolation.Kind.START_OUT_OF_ORDER, TimelineViolation.Kind.OVERLAP);
        assertThat(result.violations().get(1).sceneIds()).containsExactly("s2", "s1");
    }

    @Test
    void validateDetectsSceneNestedInsideLongEarlierScene() {
        TimelineValidationResult result = validator.validate(
                List.of(scene("s1", "0", "30"), scene("s2", "5", "5"), scene("s3", "20", "5")),
                new BigDecimal("40"));

        assertThat(result.violations())
                .filteredOn(violation -> violation.kind() == TimelineViolation.Kind.OVERLAP)
                .extracting(TimelineViolation::sceneIds)
                .containsExactly(List.of("s1", "s2"), List.of("s1", "s3"));
    }

    @Test
    void validateRequiresDeclaredDuration() {
        TimelineValidationResult result = validator.validate(List.of(scene("s1", "0", "5")), null);

        assertThat(result.valid()).isFalse();
        assertThat(result.violations().get(0).message()).isEqualTo("metadata.durationSeconds is required.");
    }

    @Test
    void validateDoesNotModifyInput() {
        List<ScenePlan> scenes = new ArrayList<>(List.of(scene("s2", "8", "4"), scene("s1", "0", "8")));

        validator.validate(scenes, new BigDecimal("12"));

        assertThat(scenes).extracting(ScenePlan::id).containsExactly("s2", "s1");
    }

    private static ScenePlan scene(String id, String start, String duration) {
        return new ScenePlan(id, new BigDecimal(start), new BigDecimal(duration), "body", null, List.of(), null);
    }
}
