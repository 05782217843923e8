package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.model.manifest.AssetPlan;
import github.sarthakdev143.production_planner.model.manifest.JobPlan;
import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;
import github.sarthakdev143.production_planner.model.manifest.MusicCue;
import github.sarthakdev143.production_planner.model.manifest.ScenePlan;
import github.sarthakdev143.production_planner.model.manifest.SceneVisual;
import github.sarthakdev143.production_planner.model.validation.DanglingReference;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Verifies that every symbolic id in a manifest draft names a declared entity.
 * An empty result means every reference resolves.
 */
@Component
public class ReferenceResolver {

    public Set<DanglingReference> resolve(ManifestDraft draft) {
        Set<DanglingReference> dangling = new LinkedHashSet<>();
        Map<String, AssetPlan> assets = draft.assets();
        Map<String, MusicCue> cues = draft.audio().cueMap();

        for (ScenePlan scene : draft.scenes()) {
            for (SceneVisual visual : scene.visuals()) {
                if (visual.assetId() == null || !assets.containsKey(visual.assetId())) {
                    dangling.add(new DanglingReference(
                            DanglingReference.Kind.SCENE_VISUAL_ASSET,
                            scene.id(),
                            String.valueOf(visual.assetId())));
                }
            }
            if (scene.musicCueId() != null && !cues.containsKey(scene.musicCueId())) {
                dangling.add(new DanglingReference(
                        DanglingReference.Kind.SCENE_MUSIC_CUE,
                        scene.id(),
                        scene.musicCueId()));
            }
        }

        for (MusicCue cue : cues.values()) {
            if (cue.assetId() != null && !assets.containsKey(cue.assetId())) {
                dangling.add(new DanglingReference(
                        DanglingReference.Kind.MUSIC_CUE_ASSET,
                        cue.id(),
                        cue.assetId()));
            }
        }

        Set<String> jobIds = new HashSet<>();
        for (JobPlan job : draft.jobs()) {
            if (!jobIds.add(job.id())) {
                dangling.add(new DanglingReference(DanglingReference.Kind.DUPLICATE_JOB_ID, job.id(), job.id()));
            }
        }

        for (JobPlan job : draft.jobs()) {
            if (job.resultAssetId() != null && !assets.containsKey(job.resultAssetId())) {
                dangling.add(new DanglingReference(
                        DanglingReference.Kind.JOB_RESULT_ASSET,
                        job.id(),
                        job.resultAssetId()));
            }
            for (String dependency : job.dependsOn()) {
                if (!jobIds.contains(dependency)) {
                    dangling.add(new DanglingReference(
                            DanglingReference.Kind.JOB_DEPENDENCY,
                            job.id(),
                            dependency));
                }
            }
        }

        return dangling;
    }
}
