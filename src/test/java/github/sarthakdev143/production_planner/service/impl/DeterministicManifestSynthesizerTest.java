package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.model.AssetAnalysisResult;
import github.sarthakdev143.production_planner.model.AssetMediaType;
import github.sarthakdev143.production_planner.model.AssetSource;
import github.sarthakdev143.production_planner.model.InputAsset;
import github.sarthakdev143.production_planner.model.JobType;
import github.sarthakdev143.production_planner.model.QueryConstraints;
import github.sarthakdev143.production_planner.model.QueryRequest;
import github.sarthakdev143.production_planner.model.SceneOutline;
import github.sarthakdev143.production_planner.model.manifest.JobPlan;
import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;
import github.sarthakdev143.production_planner.model.manifest.ScenePlan;
import github.sarthakdev143.production_planner.model.manifest.SceneVisual;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeterministicManifestSynthesizerTest {

    private final DeterministicManifestSynthesizer synthesizer = new DeterministicManifestSynthesizer();

    @Test
    void synthesizeFollowsOutlineAndPlansSupportingJobs() {
        QueryRequest request = new QueryRequest(
                "user-1",
                "Launch video for a running shoe",
                new QueryConstraints(new BigDecimal("30"), "9:16", "reels", "en"),
                List.of(
                        new InputAsset("vid_1", AssetMediaType.VIDEO, AssetSource.USER, "https://cdn.example.com/v.mp4", null, false),
                        new InputAsset("img_1", AssetMediaType.IMAGE, AssetSource.USER, "https://cdn.example.com/i.jpg", null, false)),
                List.of(
                        new SceneOutline("Intro", "Meet the new runner.", 1, "vid_1"),
                        new SceneOutline("Detail", null, 2, "img_1")));
        Map<String, AssetAnalysisResult> results = Map.of(
                "vid_1", new AssetAnalysisResult("vid_1", AssetMediaType.VIDEO, new BigDecimal("45"), 1920, 1080, 0.9, "video", Map.of()),
                "img_1", new AssetAnalysisResult("img_1", AssetMediaType.IMAGE, null, 640, 480, 0.3, "image", Map.of()));

        ManifestDraft draft = synthesizer.synthesize("q-1", request, results);

        assertThat(draft.metadata().aspectRatio()).isEqualTo("9:16");
        assertThat(draft.scenes()).extracting(ScenePlan::id).containsExactly("s1", "s2");
        assertThat(draft.scenes()).extracting(ScenePlan::startAtSec)
                .containsExactly(BigDecimal.ZERO, new BigDecimal("10.00"));
        assertThat(draft.scenes()).extracting(ScenePlan::durationSeconds)
                .containsExactly(new BigDecimal("10.00"), new BigDecimal("20.00"));
        assertThat(draft.scenes().get(0).visuals()).extracting(SceneVisual::assetId).containsExactly("vid_1");
        assertThat(draft.audio().narration()).containsEntry("s1", "Meet the new runner.");

        assertThat(draft.jobs()).extracting(JobPlan::id).containsExactly(
                "job_tts_s1",
                "job_lipsync_s1",
                "job_enhance_img_1",
                "job_music_music_01",
                "job_render");
        JobPlan lipSync = draft.jobs().get(1);
        assertThat(lipSync.type()).isEqualTo(JobType.LIP_SYNC);
        assertThat(lipSync.dependsOn()).containsExactly("job_tts_s1");
        JobPlan render = draft.jobs().get(4);
        assertThat(render.dependsOn()).containsExactly(
                "job_tts_s1", "job_lipsync_s1", "job_enhance_img_1", "job_music_music_01");

        assertThat(draft.assets()).containsKeys("vid_1", "img_1", "gen_s1_voice", "gen_music_01");
        assertThat(draft.assets().get("gen_s1_voice").ready()).isFalse();
        assertThat(draft.warnings()).containsExactly(
                "Asset vid_1 runs 45s and will be trimmed to scene s1 (10.00s).");
    }

    @Test
    void synthesizeUsesDefaultsAndGeneratedVisualWithoutAssets() {
        QueryRequest request = new QueryRequest("user-1", "Explain compound interest", null, List.of(), List.of());

        ManifestDraft draft = synthesizer.synthesize("q-1", request, Map.of());

        assertThat(draft.metadata().durationSeconds()).isEqualByComparingTo("60");
        assertThat(draft.metadata().language()).isEqualTo("en");
        assertThat(draft.scenes()).hasSize(1);
        assertThat(draft.scenes().get(0).visuals()).extracting(SceneVisual::assetId).containsExactly("gen_s1_visual");
        assertThat(draft.jobs()).extracting(JobPlan::id)
                .containsExactly("job_gen_gen_s1_visual", "job_music_music_01", "job_render");
        assertThat(draft.jobs().get(0).payload()).containsEntry("prompt", "Explain compound interest");
    }

    @Test
    void synthesizeSkipsAssetsThatFailedAnalysis() {
        QueryRequest request = new QueryRequest(
                "user-1",
                "Trip recap",
                new QueryConstraints(new BigDecimal("20"), null, null, null),
                List.of(
                        new InputAsset("img_1", AssetMediaType.IMAGE, AssetSource.USER, "https://cdn.example.com/1.jpg", null, false),
                        new InputAsset("img_2", AssetMediaType.IMAGE, AssetSource.USER, "https://cdn.example.com/2.jpg", null, true)),
                List.of());
        Map<String, AssetAnalysisResult> results = Map.of(
                "img_1", new AssetAnalysisResult("img_1", AssetMediaType.IMAGE, null, 1920, 1080, 1.0, "image", Map.of()));

        ManifestDraft draft = synthesizer.synthesize("q-1", request, results);

        assertThat(draft.scenes()).hasSize(1);
        assertThat(draft.assets()).doesNotContainKey("img_2");
        assertThat(draft.sourceRefs()).containsExactly("img_1", "img_2");
        assertThat(draft.warnings()).containsExactly("Asset img_2 was not analyzed and is excluded from the timeline.");
    }

    @Test
    void splitDurationKeepsExactTotal() {
        List<SceneOutline> outline = List.of(
                new SceneOutline(null, null, 1, null),
                new SceneOutline(null, null, 1, null),
                new SceneOutline(null, null, 1, null));

        List<BigDecimal> durations = synthesizer.splitDuration(new BigDecimal("10.005"), outline);

        assertThat(durations).containsExactly(new BigDecimal("3.33"), new BigDecimal("3.33"), new BigDecimal("3.345"));
        assertThat(durations.stream().reduce(BigDecimal.ZERO, BigDecimal::add)).isEqualByComparingTo("10.005");
    }
}
