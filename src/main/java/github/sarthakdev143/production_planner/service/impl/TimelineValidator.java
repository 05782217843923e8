package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.model.manifest.ScenePlan;
import github.sarthakdev143.production_planner.model.validation.TimelineValidationResult;
import github.sarthakdev143.production_planner.model.validation.TimelineViolation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Checks scene timing against the declared total duration.
 *
 * <p>All arithmetic is done on {@link BigDecimal} so that the total-duration comparison is exact.
 * Every violation is collected; the scene list is never modified.
 */
@Component
public class TimelineValidator {

    public TimelineValidationResult validate(List<ScenePlan> scenes, BigDecimal declaredDurationSeconds) {
        List<TimelineViolation> violations = new ArrayList<>();
        List<ScenePlan> safeScenes = scenes == null ? List.of() : scenes;

        checkDurations(safeScenes, violations);
        checkOrdering(safeScenes, violations);
        checkOverlaps(safeScenes, violations);
        checkTotalDuration(safeScenes, declaredDurationSeconds, violations);

        return TimelineValidationResult.of(violations);
    }

    private void checkDurations(List<ScenePlan> scenes, List<TimelineViolation> violations) {
        for (int index = 0; index < scenes.size(); index++) {
            ScenePlan scene = scenes.get(index);
            if (scene.durationSeconds() == null || scene.durationSeconds().signum() <= 0) {
                violations.add(new TimelineViolation(
                        TimelineViolation.Kind.NON_POSITIVE_DURATION,
                        List.of(sceneLabel(scene, index)),
                        "scenes[" + index + "] (" + sceneLabel(scene, index) + ") durationSeconds must be greater than 0."));
            }
            if (scene.startAtSec() == null || scene.startAtSec().signum() < 0) {
                violations.add(new TimelineViolation(
                        TimelineViolation.Kind.NEGATIVE_START,
                        List.of(sceneLabel(scene, index)),
                        "scenes[" + index + "] (" + sceneLabel(scene, index) + ") startAtSec must be greater than or equal to 0."));
            }
        }
    }

    private void checkOrdering(List<ScenePlan> scenes, List<TimelineViolation> violations) {
        for (int index = 1; index < scenes.size(); index++) {
            ScenePlan previous = scenes.get(index - 1);
            ScenePlan current = scenes.get(index);
            if (previous.startAtSec() == null || current.startAtSec() == null) {
                continue;
            }
            if (current.startAtSec().compareTo(previous.startAtSec()) < 0) {
                violations.add(new TimelineViolation(
                        TimelineViolation.Kind.START_OUT_OF_ORDER,
                        List.of(sceneLabel(previous, index - 1), sceneLabel(current, index)),
                        "scenes[" + index + "] (" + sceneLabel(current, index) + ") starts at "
                                + current.startAtSec().toPlainString()
                                + " before the preceding scene " + sceneLabel(previous, index - 1)
                                + " at " + previous.startAtSec().toPlainString() + "."));
            }
        }
    }

    /**
     * Sweep over scenes sorted by start time. Each scene is compared with the interval that reaches
     * furthest so far, which finds every scene that starts inside an earlier one.
     */
    private void checkOverlaps(List<ScenePlan> scenes, List<TimelineViolation> violations) {
        List<IndexedScene> sorted = new ArrayList<>();
        for (int index = 0; index < scenes.size(); index++) {
            ScenePlan scene = scenes.get(index);
            if (scene.startAtSec() != null && scene.durationSeconds() != null && scene.durationSeconds().signum() > 0) {
                sorted.add(new IndexedScene(index, scene));
            }
        }
        sorted.sort(Comparator
                .comparing((IndexedScene indexed) -> indexed.scene().startAtSec())
                .thenComparingInt(IndexedScene::index));

        IndexedScene furthest = null;
        for (IndexedScene current : sorted) {
            if (furthest != null && current.scene().startAtSec().compareTo(furthest.scene().endAtSec()) < 0) {
                String first = sceneLabel(furthest.scene(), furthest.index());
                String second = sceneLabel(current.scene(), current.index());
                violations.add(new TimelineViolation(
                        TimelineViolation.Kind.OVERLAP,
                        List.of(first, second),
                        "scene " + second + " " + interval(current.scene())
                                + " overlaps scene " + first + " " + interval(furthest.scene()) + "."));
            }
            if (furthest == null || current.scene().endAtSec().compareTo(furthest.scene().endAtSec()) > 0) {
                furthest = current;
            }
        }
    }

    private void checkTotalDuration(
            List<ScenePlan> scenes,
            BigDecimal declaredDurationSeconds,
            List<TimelineViolation> violations) {
        if (declaredDurationSeconds == null) {
            violations.add(new TimelineViolation(
                    TimelineViolation.Kind.DURATION_MISMATCH,
                    List.of(),
                    "metadata.durationSeconds is required."));
            return;
        }

        BigDecimal total = BigDecimal.ZERO;
        for (ScenePlan scene : scenes) {
            if (scene.durationSeconds() != null) {
                total = total.add(scene.durationSeconds());
            }
        }

        if (total.compareTo(declaredDurationSeconds) != 0) {
            violations.add(new TimelineViolation(
                    TimelineViolation.Kind.DURATION_MISMATCH,
                    List.of(),
                    "scene durations sum to " + total.toPlainString()
                            + " seconds but metadata.durationSeconds is "
                            + declaredDurationSeconds.toPlainString() + "."));
        }
    }

    private String interval(ScenePlan scene) {
        return "[" + scene.startAtSec().toPlainString() + ", " + scene.endAtSec().toPlainString() + ")";
    }

    private String sceneLabel(ScenePlan scene, int index) {
        return scene.id() == null || scene.id().isBlank() ? "#" + index : scene.id();
    }

    private record IndexedScene(int index, ScenePlan scene) {
    }
}
