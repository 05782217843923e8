package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;
import github.sarthakdev143.production_planner.model.manifest.ManifestMetadata;
import github.sarthakdev143.production_planner.model.manifest.ScenePlan;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic fixes applied to a draft that failed validation: missing metadata is filled with
 * planner defaults and scene durations that do not add up to the declared total are rescaled
 * proportionally and laid out back to back from zero.
 *
 * <p>The input draft is never modified. Overlaps, dangling references and dependency cycles are
 * left alone when the durations already add up.
 */
@Component
public class ManifestRepairer {

    static final BigDecimal MINIMUM_SCENE_SECONDS = new BigDecimal("0.05");

    public RepairResult repair(ManifestDraft draft) {
        List<String> repairs = new ArrayList<>();
        ManifestMetadata metadata = repairMetadata(draft.metadata(), repairs);
        List<ScenePlan> scenes = repairTimeline(draft.scenes(), metadata.durationSeconds(), repairs);
        if (repairs.isEmpty()) {
            return new RepairResult(draft, List.of());
        }

        List<String> warnings = new ArrayList<>(draft.warnings());
        warnings.addAll(repairs);
        ManifestDraft repaired = new ManifestDraft(
                draft.userId(),
                draft.sourceRefs(),
                metadata,
                scenes,
                draft.assets(),
                draft.audio(),
                draft.jobs(),
                warnings);
        return new RepairResult(repaired, repairs);
    }

    private ManifestMetadata repairMetadata(ManifestMetadata metadata, List<String> repairs) {
        if (metadata == null) {
            repairs.add("Filled missing metadata with planner defaults.");
            return new ManifestMetadata(
                    DeterministicManifestSynthesizer.DEFAULT_DURATION_SECONDS,
                    DeterministicManifestSynthesizer.DEFAULT_ASPECT_RATIO,
                    DeterministicManifestSynthesizer.DEFAULT_PLATFORM,
                    DeterministicManifestSynthesizer.DEFAULT_LANGUAGE);
        }

        BigDecimal durationSeconds = metadata.durationSeconds();
        if (durationSeconds == null || durationSeconds.signum() <= 0) {
            durationSeconds = DeterministicManifestSynthesizer.DEFAULT_DURATION_SECONDS;
            repairs.add("Replaced non-positive metadata.durationSeconds with "
                    + durationSeconds.toPlainString() + ".");
        }
        String aspectRatio = defaulted(
                metadata.aspectRatio(), "aspectRatio", DeterministicManifestSynthesizer.DEFAULT_ASPECT_RATIO, repairs);
        String platform = defaulted(
                metadata.platform(), "platform", DeterministicManifestSynthesizer.DEFAULT_PLATFORM, repairs);
        String language = defaulted(
                metadata.language(), "language", DeterministicManifestSynthesizer.DEFAULT_LANGUAGE, repairs);
        return new ManifestMetadata(durationSeconds, aspectRatio, platform, language);
    }

    private String defaulted(String value, String field, String fallback, List<String> repairs) {
        if (value != null && !value.isBlank()) {
            return value;
        }
        repairs.add("Filled missing metadata." + field + " with " + fallback + ".");
        return fallback;
    }

    private List<ScenePlan> repairTimeline(List<ScenePlan> scenes, BigDecimal totalSeconds, List<String> repairs) {
        if (scenes.isEmpty()) {
            return scenes;
        }

        BigDecimal sum = BigDecimal.ZERO;
        boolean missingDuration = false;
        for (ScenePlan scene : scenes) {
            if (scene.durationSeconds() == null) {
                missingDuration = true;
            } else {
                sum = sum.add(scene.durationSeconds());
            }
        }
        if (!missingDuration && sum.compareTo(totalSeconds) == 0) {
            return scenes;
        }

        List<BigDecimal> durations = rescale(scenes, totalSeconds);
        List<ScenePlan> repaired = new ArrayList<>();
        BigDecimal cursor = BigDecimal.ZERO;
        for (int index = 0; index < scenes.size(); index++) {
            ScenePlan scene = scenes.get(index);
            BigDecimal duration = durations.get(index);
            repaired.add(new ScenePlan(
                    scene.id(),
                    cursor,
                    duration,
                    scene.purpose(),
                    scene.narration(),
                    scene.visuals(),
                    scene.musicCueId()));
            cursor = cursor.add(duration);
        }
        repairs.add("Rescaled scene durations from " + sum.stripTrailingZeros().toPlainString()
                + " to " + totalSeconds.stripTrailingZeros().toPlainString()
                + " seconds and laid scenes out back to back.");
        return repaired;
    }

    /**
     * Proportional shares rounded down to the total's precision (hundredths at least); the last
     * scene takes whatever is left so the sum equals the total exactly.
     */
    private List<BigDecimal> rescale(List<ScenePlan> scenes, BigDecimal totalSeconds) {
        int scale = Math.max(2, totalSeconds.stripTrailingZeros().scale());
        List<BigDecimal> weights = new ArrayList<>();
        BigDecimal weightSum = BigDecimal.ZERO;
        for (ScenePlan scene : scenes) {
            BigDecimal weight = scene.durationSeconds() == null ? BigDecimal.ZERO : scene.durationSeconds().max(BigDecimal.ZERO);
            weights.add(weight);
            weightSum = weightSum.add(weight);
        }
        if (weightSum.signum() == 0) {
            weights.replaceAll(weight -> BigDecimal.ONE);
            weightSum = BigDecimal.valueOf(scenes.size());
        }

        List<BigDecimal> durations = new ArrayList<>();
        BigDecimal assigned = BigDecimal.ZERO;
        for (int index = 0; index < scenes.size(); index++) {
            BigDecimal share;
            if (index == scenes.size() - 1) {
                share = totalSeconds.subtract(assigned);
            } else {
                share = totalSeconds.multiply(weights.get(index))
                        .divide(weightSum, scale, RoundingMode.DOWN)
                        .max(MINIMUM_SCENE_SECONDS);
            }
            assigned = assigned.add(share);
            durations.add(share);
        }
        return durations;
    }

    public record RepairResult(ManifestDraft draft, List<String> repairs) {

        public RepairResult {
            repairs = List.copyOf(repairs);
        }

        public boolean repaired() {
            return !repairs.isEmpty();
        }
    }
}
