package github.sarthakdev143.production_planner.model.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unvalidated manifest content. Asset iteration order follows declaration order.
 */
public record ManifestDraft(
        String userId,
        List<String> sourceRefs,
        ManifestMetadata metadata,
        List<ScenePlan> scenes,
        Map<String, AssetPlan> assets,
        AudioPlan audio,
        List<JobPlan> jobs,
        List<String> warnings) {

    public ManifestDraft {
        sourceRefs = sourceRefs == null ? List.of() : List.copyOf(sourceRefs);
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
        assets = assets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(assets));
        audio = audio == null ? new AudioPlan(null, Map.of(), Map.of()) : audio;
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
