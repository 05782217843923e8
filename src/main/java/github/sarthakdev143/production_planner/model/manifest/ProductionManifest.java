package github.sarthakdev143.production_planner.model.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The validated production plan handed to dispatchers. Only built by the manifest assembler.
 */
public record ProductionManifest(
        String queryId,
        String userId,
        List<String> sourceRefs,
        ManifestMetadata metadata,
        List<ScenePlan> scenes,
        Map<String, AssetPlan> assets,
        AudioPlan audio,
        List<JobPlan> jobs,
        QualityGate qualityGate,
        List<String> warnings) {

    public ProductionManifest {
        sourceRefs = sourceRefs == null ? List.of() : List.copyOf(sourceRefs);
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
        assets = assets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(assets));
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
