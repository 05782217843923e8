package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.model.AssetAnalysisResult;
import github.sarthakdev143.production_planner.model.AssetMediaType;
import github.sarthakdev143.production_planner.model.AssetSource;
import github.sarthakdev143.production_planner.model.InputAsset;
import github.sarthakdev143.production_planner.model.JobType;
import github.sarthakdev143.production_planner.model.QueryConstraints;
import github.sarthakdev143.production_planner.model.QueryRequest;
import github.sarthakdev143.production_planner.model.SceneOutline;
import github.sarthakdev143.production_planner.model.manifest.AssetPlan;
import github.sarthakdev143.production_planner.model.manifest.AudioPlan;
import github.sarthakdev143.production_planner.model.manifest.JobPlan;
import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;
import github.sarthakdev143.production_planner.model.manifest.ManifestMetadata;
import github.sarthakdev143.production_planner.model.manifest.MusicCue;
import github.sarthakdev143.production_planner.model.manifest.RetryPolicy;
import github.sarthakdev143.production_planner.model.manifest.ScenePlan;
import github.sarthakdev143.production_planner.model.manifest.SceneVisual;
import github.sarthakdev143.production_planner.model.manifest.TtsDefaults;
import github.sarthakdev143.production_planner.service.ManifestSynthesizer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a manifest draft without any model calls.
 *
 * <p>Scene durations are split by weight in hundredths of a second and the last scene takes the
 * remainder, so the scene durations always add up to the requested total. Scenes without a usable
 * user asset get a generated placeholder visual with a matching generation job. A single music cue
 * spans the whole timeline, and a final render job depends on every other job.
 */
@Component
public class DeterministicManifestSynthesizer implements ManifestSynthesizer {

    static final BigDecimal DEFAULT_DURATION_SECONDS = BigDecimal.valueOf(60);
    static final String DEFAULT_ASPECT_RATIO = "16:9";
    static final String DEFAULT_PLATFORM = "social";
    static final String DEFAULT_LANGUAGE = "en";
    static final String MUSIC_CUE_ID = "music_01";
    static final String RENDER_JOB_ID = "job_render";
    private static final double ENHANCEMENT_QUALITY_THRESHOLD = 0.5;
    private static final TtsDefaults TTS_DEFAULTS = new TtsDefaults("elevenlabs", "eva", "mp3");
    private static final RetryPolicy GENERATION_RETRY_POLICY = new RetryPolicy(3, 30);
    private static final RetryPolicy RENDER_RETRY_POLICY = new RetryPolicy(3, 120);

    @Override
    public ManifestDraft synthesize(
            String queryId,
            QueryRequest request,
            Map<String, AssetAnalysisResult> analysisResults) {
        ManifestMetadata metadata = resolveMetadata(request.constraints());
        List<String> warnings = new ArrayList<>();
        Map<String, InputAsset> inputsById = new LinkedHashMap<>();
        request.assets().forEach(asset -> inputsById.put(asset.id(), asset));

        Map<String, AssetPlan> assets = new LinkedHashMap<>();
        for (InputAsset input : request.assets()) {
            AssetAnalysisResult result = analysisResults.get(input.id());
            if (result == null) {
                warnings.add("Asset " + input.id() + " was not analyzed and is excluded from the timeline.");
                continue;
            }
            assets.put(input.id(), new AssetPlan(
                    input.id(),
                    input.mediaType(),
                    input.source(),
                    "primary",
                    input.url(),
                    input.required(),
                    true,
                    result.qualityScore()));
        }

        List<SceneOutline> outline = resolveOutline(request, analysisResults);
        List<BigDecimal> durations = splitDuration(metadata.durationSeconds(), outline);

        List<ScenePlan> scenes = new ArrayList<>();
        Map<String, String> narration = new LinkedHashMap<>();
        List<JobPlan> jobs = new ArrayList<>();
        BigDecimal cursor = BigDecimal.ZERO;

        for (int index = 0; index < outline.size(); index++) {
            SceneOutline sceneOutline = outline.get(index);
            String sceneId = "s" + (index + 1);
            BigDecimal duration = durations.get(index);
            List<SceneVisual> visuals = new ArrayList<>();

            String userAssetId = usableVisualAsset(sceneOutline.assetId(), inputsById, analysisResults, warnings, sceneId);
            if (userAssetId != null) {
                visuals.add(new SceneVisual(userAssetId, "primary"));
                addUserAssetJobs(userAssetId, analysisResults.get(userAssetId), duration, sceneId, jobs, warnings);
            } else {
                String generatedId = "gen_" + sceneId + "_visual";
                assets.put(generatedId, generatedAsset(generatedId, AssetMediaType.IMAGE, "background"));
                visuals.add(new SceneVisual(generatedId, "background"));
                jobs.add(new JobPlan(
                        "job_gen_" + generatedId,
                        JobType.IMAGE_GENERATION,
                        Map.of(
                                "sceneId", sceneId,
                                "prompt", buildVisualPrompt(request.prompt(), sceneOutline.title()),
                                "aspectRatio", metadata.aspectRatio()),
                        List.of(),
                        10,
                        generatedId,
                        GENERATION_RETRY_POLICY));
            }

            if (sceneOutline.narration() != null && !sceneOutline.narration().isBlank()) {
                String narrationText = sceneOutline.narration().trim();
                narration.put(sceneId, narrationText);
                String voiceAssetId = "gen_" + sceneId + "_voice";
                String ttsJobId = "job_tts_" + sceneId;
                assets.put(voiceAssetId, generatedAsset(voiceAssetId, AssetMediaType.AUDIO, "narration"));
                jobs.add(new JobPlan(
                        ttsJobId,
                        JobType.SPEECH_SYNTHESIS,
                        Map.of(
                                "sceneId", sceneId,
                                "text", narrationText,
                                "provider", TTS_DEFAULTS.provider(),
                                "voiceId", TTS_DEFAULTS.voiceId(),
                                "format", TTS_DEFAULTS.format(),
                                "language", metadata.language()),
                        List.of(),
                        10,
                        voiceAssetId,
                        GENERATION_RETRY_POLICY));

                if (userAssetId != null && inputsById.get(userAssetId).mediaType() == AssetMediaType.VIDEO) {
                    jobs.add(new JobPlan(
                            "job_lipsync_" + sceneId,
                            JobType.LIP_SYNC,
                            Map.of("sceneId", sceneId, "videoAssetId", userAssetId, "audioAssetId", voiceAssetId),
                            List.of(ttsJobId),
                            8,
                            null,
                            GENERATION_RETRY_POLICY));
                }
            }

            scenes.add(new ScenePlan(
                    sceneId,
                    cursor,
                    duration,
                    sceneOutline.title() == null || sceneOutline.title().isBlank() ? "body" : sceneOutline.title().trim(),
                    narration.get(sceneId),
                    visuals,
                    MUSIC_CUE_ID));
            cursor = cursor.add(duration);
        }

        String musicAssetId = "gen_" + MUSIC_CUE_ID;
        assets.put(musicAssetId, generatedAsset(musicAssetId, AssetMediaType.AUDIO, "music"));
        MusicCue cue = new MusicCue(MUSIC_CUE_ID, BigDecimal.ZERO, metadata.durationSeconds(), "neutral", musicAssetId);
        jobs.add(new JobPlan(
                "job_music_" + MUSIC_CUE_ID,
                JobType.MUSIC_GENERATION,
                Map.of("cueId", MUSIC_CUE_ID, "mood", cue.mood(), "durationSec", cue.durationSec().toPlainString()),
                List.of(),
                5,
                musicAssetId,
                GENERATION_RETRY_POLICY));

        List<String> everyJob = jobs.stream().map(JobPlan::id).toList();
        jobs.add(new JobPlan(
                RENDER_JOB_ID,
                JobType.RENDER,
                Map.of("queryId", queryId, "aspectRatio", metadata.aspectRatio()),
                everyJob,
                12,
                null,
                RENDER_RETRY_POLICY));

        List<String> sourceRefs = request.assets().stream().map(InputAsset::id).toList();
        return new ManifestDraft(
                request.userId(),
                sourceRefs,
                metadata,
                scenes,
                assets,
                new AudioPlan(TTS_DEFAULTS, narration, Map.of(MUSIC_CUE_ID, cue)),
                jobs,
                warnings);
    }

    private ManifestMetadata resolveMetadata(QueryConstraints constraints) {
        if (constraints == null) {
            return new ManifestMetadata(DEFAULT_DURATION_SECONDS, DEFAULT_ASPECT_RATIO, DEFAULT_PLATFORM, DEFAULT_LANGUAGE);
        }
        return new ManifestMetadata(
                constraints.durationSeconds() == null ? DEFAULT_DURATION_SECONDS : constraints.durationSeconds(),
                valueOrDefault(constraints.aspectRatio(), DEFAULT_ASPECT_RATIO),
                valueOrDefault(constraints.platform(), DEFAULT_PLATFORM),
                valueOrDefault(constraints.language(), DEFAULT_LANGUAGE));
    }

    /**
     * Uses the caller's scene outline when given; otherwise one scene per analyzed visual asset,
     * or a single scene when there is none.
     */
    private List<SceneOutline> resolveOutline(QueryRequest request, Map<String, AssetAnalysisResult> analysisResults) {
        if (!request.sceneOutline().isEmpty()) {
            return request.sceneOutline();
        }

        List<SceneOutline> outline = new ArrayList<>();
        for (InputAsset asset : request.assets()) {
            if (asset.mediaType() != AssetMediaType.AUDIO && analysisResults.containsKey(asset.id())) {
                outline.add(new SceneOutline(asset.description(), null, 1, asset.id()));
            }
        }
        if (outline.isEmpty()) {
            outline.add(new SceneOutline(null, null, 1, null));
        }
        return outline;
    }

    List<BigDecimal> splitDuration(BigDecimal totalSeconds, List<SceneOutline> outline) {
        BigInteger totalHundredths = totalSeconds.movePointRight(2).toBigInteger();
        long weightSum = 0;
        for (SceneOutline scene : outline) {
            weightSum += Math.max(1, scene.durationWeight());
        }

        List<BigDecimal> durations = new ArrayList<>();
        BigInteger assigned = BigInteger.ZERO;
        for (int index = 0; index < outline.size(); index++) {
            BigInteger share;
            if (index == outline.size() - 1) {
                share = totalHundredths.subtract(assigned);
            } else {
                share = totalHundredths
                        .multiply(BigInteger.valueOf(Math.max(1, outline.get(index).durationWeight())))
                        .divide(BigInteger.valueOf(weightSum));
            }
            assigned = assigned.add(share);
            durations.add(new BigDecimal(share, 2));
        }

        // Fractions below a hundredth stay with the last scene so the sum matches exactly.
        BigDecimal remainder = totalSeconds.subtract(new BigDecimal(totalHundredths, 2));
        if (remainder.signum() != 0) {
            int last = durations.size() - 1;
            durations.set(last, durations.get(last).add(remainder));
        }
        return durations;
    }

    private String usableVisualAsset(
            String assetId,
            Map<String, InputAsset> inputsById,
            Map<String, AssetAnalysisResult> analysisResults,
            List<String> warnings,
            String sceneId) {
        if (assetId == null || assetId.isBlank()) {
            return null;
        }
        InputAsset input = inputsById.get(assetId);
        if (input == null || input.mediaType() == AssetMediaType.AUDIO) {
            warnings.add("Scene " + sceneId + " asks for " + assetId + ", which is not a visual asset; using a generated visual.");
            return null;
        }
        if (!analysisResults.containsKey(assetId)) {
            warnings.add("Scene " + sceneId + " asks for " + assetId + ", which failed analysis; using a generated visual.");
            return null;
        }
        return assetId;
    }

    private void addUserAssetJobs(
            String assetId,
            AssetAnalysisResult result,
            BigDecimal sceneDuration,
            String sceneId,
            List<JobPlan> jobs,
            List<String> warnings) {
        if (result.mediaType() == AssetMediaType.IMAGE && result.qualityScore() < ENHANCEMENT_QUALITY_THRESHOLD) {
            String jobId = "job_enhance_" + assetId;
            if (jobs.stream().noneMatch(job -> job.id().equals(jobId))) {
                jobs.add(new JobPlan(
                        jobId,
                        JobType.IMAGE_ENHANCEMENT,
                        Map.of("assetId", assetId, "qualityScore", result.qualityScore()),
                        List.of(),
                        8,
                        assetId,
                        GENERATION_RETRY_POLICY));
            }
        }
        if (result.durationSeconds() != null && result.durationSeconds().compareTo(sceneDuration) > 0) {
            warnings.add("Asset " + assetId + " runs " + result.durationSeconds().toPlainString()
                    + "s and will be trimmed to scene " + sceneId + " (" + sceneDuration.toPlainString() + "s).");
        }
    }

    private AssetPlan generatedAsset(String id, AssetMediaType mediaType, String role) {
        return new AssetPlan(id, mediaType, AssetSource.GENERATED, role, null, true, false, null);
    }

    private String buildVisualPrompt(String userPrompt, String sceneTitle) {
        String base = userPrompt == null ? "" : userPrompt.trim();
        if (sceneTitle == null || sceneTitle.isBlank()) {
            return base;
        }
        return base.isEmpty() ? sceneTitle.trim() : base + " | scene: " + sceneTitle.trim();
    }

    private String valueOrDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
