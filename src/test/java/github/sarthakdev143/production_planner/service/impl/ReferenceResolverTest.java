package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.model.AssetMediaType;
import github.sarthakdev143.production_planner.model.AssetSource;
import github.sarthakdev143.production_planner.model.JobType;
import github.sarthakdev143.production_planner.model.manifest.AssetPlan;
import github.sarthakdev143.production_planner.model.manifest.AudioPlan;
import github.sarthakdev143.production_planner.model.manifest.JobPlan;
import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;
import github.sarthakdev143.production_planner.model.manifest.ManifestMetadata;
import github.sarthakdev143.production_planner.model.manifest.MusicCue;
import github.sarthakdev143.production_planner.model.manifest.ScenePlan;
import github.sarthakdev143.production_planner.model.manifest.SceneVisual;
import github.sarthakdev143.production_planner.model.validation.DanglingReference;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceResolverTest {

    private final ReferenceResolver resolver = new ReferenceResolver();

    @Test
    void resolveReturnsEmptySetWhenEveryReferenceResolves() {
        ManifestDraft draft = draft(
                List.of(scene("s1", "music_01", "img_1")),
                Map.of("music_01", new MusicCue("music_01", BigDecimal.ZERO, BigDecimal.TEN, "calm", "gen_music")),
                List.of(
                        job("job_music", JobType.MUSIC_GENERATION, "gen_music"),
                        job("job_render", JobType.RENDER, null, "job_music")));

        assertThat(resolver.resolve(draft)).isEmpty();
    }

    @Test
    void resolveReportsEveryUnresolvedReference() {
        ManifestDraft draft = draft(
                List.of(scene("s1", "music_02", "img_missing")),
                Map.of("music_01", new MusicCue("music_01", BigDecimal.ZERO, BigDecimal.TEN, "calm", "gen_other")),
                List.of(
                        job("job_voice", JobType.SPEECH_SYNTHESIS, "gen_voice_missing"),
                        job("job_render", JobType.RENDER, null, "job_voice", "job_ghost")));

        Set<DanglingReference> dangling = resolver.resolve(draft);

        assertThat(dangling).containsExactlyInAnyOrder(
                new DanglingReference(DanglingReference.Kind.SCENE_VISUAL_ASSET, "s1", "img_missing"),
                new DanglingReference(DanglingReference.Kind.SCENE_MUSIC_CUE, "s1", "music_02"),
                new DanglingReference(DanglingReference.Kind.MUSIC_CUE_ASSET, "music_01", "gen_other"),
                new DanglingReference(DanglingReference.Kind.JOB_RESULT_ASSET, "job_voice", "gen_voice_missing"),
                new DanglingReference(DanglingReference.Kind.JOB_DEPENDENCY, "job_render", "job_ghost"));
    }

    @Test
    void resolveReportsDuplicateJobIdsOnce() {
        ManifestDraft draft = draft(
                List.of(scene("s1", null, "img_1")),
                Map.of(),
                List.of(
                        job("job_a", JobType.IMAGE_GENERATION, null),
                        job("job_a", JobType.IMAGE_GENERATION, null),
                        job("job_a", JobType.IMAGE_GENERATION, null)));

        assertThat(resolver.resolve(draft)).containsExactly(
                new DanglingReference(DanglingReference.Kind.DUPLICATE_JOB_ID, "job_a", "job_a"));
    }

    @Test
    void describeNamesOwnerAndMissingId() {
        DanglingReference reference = new DanglingReference(DanglingReference.Kind.SCENE_VISUAL_ASSET, "s4", "img_9");

        assertThat(reference.describe()).isEqualTo("scene s4 references unknown asset img_9");
    }

    private static ManifestDraft draft(List<ScenePlan> scenes, Map<String, MusicCue> cues, List<JobPlan> jobs) {
        Map<String, AssetPlan> assets = new LinkedHashMap<>();
        assets.put("img_1", asset("img_1", AssetMediaType.IMAGE, AssetSource.USER));
        assets.put("gen_music", asset("gen_music", AssetMediaType.AUDIO, AssetSource.GENERATED));
        return new ManifestDraft(
                "user-1",
                List.of(),
                new ManifestMetadata(BigDecimal.TEN, "16:9", "social", "en"),
                scenes,
                assets,
                new AudioPlan(null, Map.of(), cues),
                jobs,
                List.of());
    }

    private static ScenePlan scene(String id, String musicCueId, String assetId) {
        return new ScenePlan(
                id,
                BigDecimal.ZERO,
                BigDecimal.TEN,
                "body",
                null,
                List.of(new SceneVisual(assetId, "primary")),
                musicCueId);
    }

    private static AssetPlan asset(String id, AssetMediaType type, AssetSource source) {
        return new AssetPlan(id, type, source, "visual", null, true, source == AssetSource.USER, null);
    }

    private static JobPlan job(String id, JobType type, String resultAssetId, String... dependsOn) {
        return new JobPlan(id, type, Map.of(), List.of(dependsOn), 0, resultAssetId, null);
    }
}
