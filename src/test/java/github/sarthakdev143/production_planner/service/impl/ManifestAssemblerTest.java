package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.model.AssetMediaType;
import github.sarthakdev143.production_planner.model.AssetSource;
import github.sarthakdev143.production_planner.model.JobType;
import github.sarthakdev143.production_planner.model.QueryConstraints;
import github.sarthakdev143.production_planner.model.QueryRequest;
import github.sarthakdev143.production_planner.model.manifest.AssetPlan;
import github.sarthakdev143.production_planner.model.manifest.AudioPlan;
import github.sarthakdev143.production_planner.model.manifest.JobPlan;
import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;
import github.sarthakdev143.production_planner.model.manifest.ManifestMetadata;
import github.sarthakdev143.production_planner.model.manifest.ScenePlan;
import github.sarthakdev143.production_planner.model.manifest.SceneVisual;
import github.sarthakdev143.production_planner.model.validation.DanglingReference;
import github.sarthakdev143.production_planner.model.validation.TimelineViolation;
import github.sarthakdev143.production_planner.model.validation.ValidationReport;
import github.sarthakdev143.production_planner.service.scheduling.JobGraphBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ManifestAssemblerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ManifestAssembler assembler = new ManifestAssembler(
            new TimelineValidator(),
            new ReferenceResolver(),
            new JobGraphBuilder(),
            new ManifestRepairer(),
            meterRegistry);

    @Test
    void assembleFreezesSynthesizedDraft() {
        QueryRequest request = new QueryRequest(
                "user-1",
                "Weekly update",
                new QueryConstraints(new BigDecimal("45"), null, null, null),
                List.of(),
                List.of());
        ManifestDraft draft = new DeterministicManifestSynthesizer().synthesize("q-1", request, Map.of());

        ManifestAssembler.AssemblyResult result = assembler.assemble("q-1", draft);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.report().valid()).isTrue();
        assertThat(result.manifest().queryId()).isEqualTo("q-1");
        assertThat(result.manifest().jobs()).hasSameSizeAs(draft.jobs());
        assertThat(result.manifest().qualityGate().durationCompliance()).isTrue();
        assertThat(result.manifest().qualityGate().requiredAssetsReady()).isFalse();
        assertThat(meterRegistry.counter("production_planner.manifests.assembled").count()).isEqualTo(1.0);
    }

    @Test
    void requiredAssetsReadyWhenEveryRequiredAssetIsReady() {
        ManifestDraft draft = draft(
                List.of(scene("s1", "0", "10", "img_1")),
                List.of(job("job_render", JobType.RENDER)));

        ManifestAssembler.AssemblyResult result = assembler.assemble("q-1", draft);

        assertThat(result.manifest().qualityGate().requiredAssetsReady()).isTrue();
    }

    @Test
    void assembleRejectsDraftAndReportsEveryProblemClass() {
        ManifestDraft draft = draft(
                List.of(scene("s1", "0", "6", "img_1"), scene("s2", "5", "4", "img_ghost")),
                List.of(
                        job("job_a", JobType.IMAGE_GENERATION, "job_b"),
                        job("job_b", JobType.IMAGE_ENHANCEMENT, "job_a"),
                        job("job_render", JobType.RENDER, "job_a", "job_missing")));

        ManifestAssembler.AssemblyResult result = assembler.assemble("q-1", draft);

        assertThat(result.succeeded()).isFalse();
        assertThat(result.manifest()).isNull();
        ValidationReport report = result.report();
        assertThat(report.timelineViolations())
                .extracting(TimelineViolation::kind)
                .containsExactly(TimelineViolation.Kind.OVERLAP);
        assertThat(report.danglingReferences()).containsExactlyInAnyOrder(
                new DanglingReference(DanglingReference.Kind.SCENE_VISUAL_ASSET, "s2", "img_ghost"),
                new DanglingReference(DanglingReference.Kind.JOB_DEPENDENCY, "job_render", "job_missing"));
        assertThat(report.cycle()).containsExactly("job_a", "job_b");
        assertThat(report.describe()).contains("job dependency cycle: job_a -> job_b -> job_a");
        assertThat(meterRegistry.counter("production_planner.manifests.rejected").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("production_planner.manifests.repaired").count()).isZero();
    }

    @Test
    void assembleRepairsDriftedDurationsBeforeValidatingAgain() {
        ManifestDraft draft = draft(
                List.of(scene("s1", "0", "4", "img_1"), scene("s2", "4", "7", "img_1")),
                List.of(job("job_render", JobType.RENDER)));

        ManifestAssembler.AssemblyResult result = assembler.assemble("q-1", draft);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.report().valid()).isTrue();
        assertThat(result.manifest().scenes())
                .extracting(ScenePlan::startAtSec, ScenePlan::durationSeconds)
                .containsExactly(
                        tuple(new BigDecimal("0"), new BigDecimal("3.63")),
                        tuple(new BigDecimal("3.63"), new BigDecimal("6.37")));
        assertThat(result.manifest().warnings())
                .containsExactly("Rescaled scene durations from 11 to 10 seconds and laid scenes out back to back.");
        assertThat(draft.scenes().get(1).durationSeconds()).isEqualByComparingTo("7");
        assertThat(meterRegistry.counter("production_planner.manifests.repaired").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("production_planner.manifests.assembled").count()).isEqualTo(1.0);
    }

    @Test
    void assembleRejectsWithReportOfRepairedDraftWhenRepairIsNotEnough() {
        ManifestDraft draft = draft(
                List.of(scene("s1", "0", "4", "img_1"), scene("s2", "4", "7", "img_ghost")),
                List.of(job("job_render", JobType.RENDER)));

        ManifestAssembler.AssemblyResult result = assembler.assemble("q-1", draft);

        assertThat(result.succeeded()).isFalse();
        assertThat(result.report().timelineViolations()).isEmpty();
        assertThat(result.report().danglingReferences()).containsExactly(
                new DanglingReference(DanglingReference.Kind.SCENE_VISUAL_ASSET, "s2", "img_ghost"));
        assertThat(meterRegistry.counter("production_planner.manifests.repaired").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("production_planner.manifests.rejected").count()).isEqualTo(1.0);
    }

    @Test
    void danglingReferencesKeepDiscoveryOrder() {
        ValidationReport report = assembler.validate(draft(
                List.of(scene("s1", "0", "5", "img_zeta"), scene("s2", "5", "5", "img_alpha")),
                List.of(job("job_render", JobType.RENDER, "job_missing"))));

        assertThat(report.danglingReferences()).containsExactly(
                new DanglingReference(DanglingReference.Kind.SCENE_VISUAL_ASSET, "s1", "img_zeta"),
                new DanglingReference(DanglingReference.Kind.SCENE_VISUAL_ASSET, "s2", "img_alpha"),
                new DanglingReference(DanglingReference.Kind.JOB_DEPENDENCY, "job_render", "job_missing"));
    }

    @Test
    void validateDoesNotCountAssemblies() {
        ValidationReport report = assembler.validate(draft(
                List.of(scene("s1", "0", "10", "img_1")),
                List.of()));

        assertThat(report.valid()).isTrue();
        assertThat(meterRegistry.counter("production_planner.manifests.assembled").count()).isZero();
    }

    private static ManifestDraft draft(List<ScenePlan> scenes, List<JobPlan> jobs) {
        return new ManifestDraft(
                "user-1",
                List.of("img_1"),
                new ManifestMetadata(BigDecimal.TEN, "16:9", "social", "en"),
                scenes,
                Map.of("img_1", new AssetPlan("img_1", AssetMediaType.IMAGE, AssetSource.USER, "primary",
                        "https://cdn.example.com/1.jpg", true, true, 0.9)),
                new AudioPlan(null, Map.of(), Map.of()),
                jobs,
                List.of());
    }

    private static ScenePlan scene(String id, String start, String duration, String assetId) {
        return new ScenePlan(id, new BigDecimal(start), new BigDecimal(duration), "body", null,
                List.of(new SceneVisual(assetId, "primary")), null);
    }

    private static JobPlan job(String id, JobType type, String... dependsOn) {
        return new JobPlan(id, type, Map.of(), List.of(dependsOn), 0, null, null);
    }
}
