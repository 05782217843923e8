package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.dto.ManifestDocumentRequest;
import github.sarthakdev143.production_planner.model.AssetMediaType;
import github.sarthakdev143.production_planner.model.AssetSource;
import github.sarthakdev143.production_planner.model.JobType;
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
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Maps an externally supplied manifest document onto a {@link ManifestDraft}.
 *
 * <p>Only shape problems are rejected here (missing ids, missing times, unknown enumerated values).
 * Timeline, reference and dependency problems are left for the manifest assembler to report.
 */
@Component
public class ManifestDocumentMapper {

    private static final String STATUS_READY = "ready";
    private static final String STATUS_PENDING = "pending";

    public ManifestDraft toDraft(ManifestDocumentRequest document) {
        if (document == null) {
            throw new IllegalArgumentException("manifest is required.");
        }
        if (document.metadata() == null) {
            throw new IllegalArgumentException("manifest.metadata is required.");
        }

        BigDecimal declaredDuration = document.metadata().durationSeconds();
        if (declaredDuration == null) {
            throw new IllegalArgumentException("manifest.metadata.durationSeconds is required.");
        }

        ManifestMetadata metadata = new ManifestMetadata(
                declaredDuration,
                document.metadata().aspectRatio(),
                document.metadata().platform(),
                document.metadata().language());

        return new ManifestDraft(
                document.userId(),
                document.sourceRefs() == null ? List.of() : document.sourceRefs().stream().filter(Objects::nonNull).toList(),
                metadata,
                mapScenes(document.scenes()),
                mapAssets(document.assets()),
                mapAudio(document.audio()),
                mapJobs(document.jobs()),
                document.warnings() == null ? List.of() : document.warnings().stream().filter(Objects::nonNull).toList());
    }

    private List<ScenePlan> mapScenes(List<ManifestDocumentRequest.Scene> scenes) {
        if (scenes == null) {
            return List.of();
        }

        List<ScenePlan> mapped = new ArrayList<>();
        for (int index = 0; index < scenes.size(); index++) {
            ManifestDocumentRequest.Scene scene = scenes.get(index);
            String field = "manifest.scenes[" + index + "]";
            if (scene == null) {
                throw new IllegalArgumentException(field + " must not be null.");
            }

            String id = requireText(scene.id(), field + ".id");
            if (scene.startAtSec() == null) {
                throw new IllegalArgumentException(field + ".startAtSec is required.");
            }
            if (scene.durationSeconds() == null) {
                throw new IllegalArgumentException(field + ".durationSeconds is required.");
            }

            List<SceneVisual> visuals = new ArrayList<>();
            if (scene.visuals() != null) {
                for (int visualIndex = 0; visualIndex < scene.visuals().size(); visualIndex++) {
                    ManifestDocumentRequest.Visual visual = scene.visuals().get(visualIndex);
                    String visualField = field + ".visuals[" + visualIndex + "]";
                    if (visual == null) {
                        throw new IllegalArgumentException(visualField + " must not be null.");
                    }
                    visuals.add(new SceneVisual(requireText(visual.assetId(), visualField + ".assetId"), visual.role()));
                }
            }

            mapped.add(new ScenePlan(
                    id,
                    scene.startAtSec(),
                    scene.durationSeconds(),
                    scene.purpose(),
                    scene.narration(),
                    visuals,
                    blankToNull(scene.musicCue())));
        }
        return mapped;
    }

    private Map<String, AssetPlan> mapAssets(Map<String, ManifestDocumentRequest.Asset> assets) {
        if (assets == null) {
            return Map.of();
        }

        Map<String, AssetPlan> mapped = new LinkedHashMap<>();
        for (Map.Entry<String, ManifestDocumentRequest.Asset> entry : assets.entrySet()) {
            String key = entry.getKey();
            String field = "manifest.assets." + key;
            ManifestDocumentRequest.Asset asset = entry.getValue();
            if (asset == null) {
                throw new IllegalArgumentException(field + " must not be null.");
            }

            String id = blankToNull(asset.id());
            if (id != null && !id.equals(key)) {
                throw new IllegalArgumentException(field + ".id must match its key, got '" + id + "'.");
            }

            mapped.put(key, new AssetPlan(
                    key,
                    parseField(field, asset.type(), AssetMediaType::fromInput),
                    parseField(field, asset.source(), AssetSource::fromInput),
                    asset.role(),
                    asset.originUrl(),
                    !Boolean.FALSE.equals(asset.required()),
                    parseReady(field, asset.status()),
                    null));
        }
        return mapped;
    }

    private AudioPlan mapAudio(ManifestDocumentRequest.Audio audio) {
        if (audio == null) {
            return null;
        }

        TtsDefaults ttsDefaults = audio.ttsDefaults() == null
                ? null
                : new TtsDefaults(audio.ttsDefaults().provider(), audio.ttsDefaults().voiceId(), audio.ttsDefaults().format());

        Map<String, String> narration = new LinkedHashMap<>();
        if (audio.narration() != null) {
            audio.narration().forEach((sceneId, text) -> {
                if (text != null) {
                    narration.put(sceneId, text);
                }
            });
        }

        Map<String, MusicCue> cues = new LinkedHashMap<>();
        if (audio.cueMap() != null) {
            for (Map.Entry<String, ManifestDocumentRequest.MusicCue> entry : audio.cueMap().entrySet()) {
                String key = entry.getKey();
                ManifestDocumentRequest.MusicCue cue = entry.getValue();
                if (cue == null) {
                    throw new IllegalArgumentException("manifest.audio.cueMap." + key + " must not be null.");
                }
                cues.put(key, new MusicCue(
                        key,
                        cue.startSec(),
                        cue.durationSec(),
                        cue.mood(),
                        blankToNull(cue.assetId())));
            }
        }

        return new AudioPlan(ttsDefaults, narration, cues);
    }

    private List<JobPlan> mapJobs(List<ManifestDocumentRequest.Job> jobs) {
        if (jobs == null) {
            return List.of();
        }

        List<JobPlan> mapped = new ArrayList<>();
        for (int index = 0; index < jobs.size(); index++) {
            ManifestDocumentRequest.Job job = jobs.get(index);
            String field = "manifest.jobs[" + index + "]";
            if (job == null) {
                throw new IllegalArgumentException(field + " must not be null.");
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            if (job.payload() != null) {
                job.payload().forEach((key, value) -> {
                    if (value != null) {
                        payload.put(key, value);
                    }
                });
            }

            String resultAssetId = blankToNull(job.resultAssetId());
            if (resultAssetId == null && payload.get("resultAssetId") instanceof String fromPayload) {
                resultAssetId = blankToNull(fromPayload);
            }

            List<String> dependsOn = new ArrayList<>();
            if (job.dependsOn() != null) {
                for (int dependencyIndex = 0; dependencyIndex < job.dependsOn().size(); dependencyIndex++) {
                    dependsOn.add(requireText(job.dependsOn().get(dependencyIndex), field + ".dependsOn[" + dependencyIndex + "]"));
                }
            }

            mapped.add(new JobPlan(
                    requireText(job.id(), field + ".id"),
                    parseField(field, job.type(), JobType::fromInput),
                    payload,
                    dependsOn,
                    job.priority() == null ? 0 : job.priority(),
                    resultAssetId,
                    mapRetryPolicy(field, job.retryPolicy())));
        }
        return mapped;
    }

    private RetryPolicy mapRetryPolicy(String field, ManifestDocumentRequest.RetryPolicy retryPolicy) {
        if (retryPolicy == null) {
            return RetryPolicy.DEFAULT;
        }

        int maxRetries = retryPolicy.maxRetries() == null ? RetryPolicy.DEFAULT.maxRetries() : retryPolicy.maxRetries();
        int backoffSeconds = retryPolicy.backoffSeconds() == null
                ? RetryPolicy.DEFAULT.backoffSeconds()
                : retryPolicy.backoffSeconds();
        if (maxRetries < 0) {
            throw new IllegalArgumentException(field + ".retryPolicy.maxRetries must not be negative.");
        }
        if (backoffSeconds < 0) {
            throw new IllegalArgumentException(field + ".retryPolicy.backoffSeconds must not be negative.");
        }
        return new RetryPolicy(maxRetries, backoffSeconds);
    }

    private boolean parseReady(String field, String status) {
        String normalized = blankToNull(status);
        if (normalized == null) {
            return false;
        }
        normalized = normalized.toLowerCase(Locale.ROOT);
        if (STATUS_READY.equals(normalized)) {
            return true;
        }
        if (STATUS_PENDING.equals(normalized)) {
            return false;
        }
        throw new IllegalArgumentException(field + ".status must be one of ready, pending.");
    }

    private <T> T parseField(String field, String input, Function<String, T> parser) {
        try {
            return parser.apply(input);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(field + "." + ex.getMessage(), ex);
        }
    }

    private static String requireText(String value, String field) {
        String normalized = blankToNull(value);
        if (normalized == null) {
            throw new IllegalArgumentException(field + " is required.");
        }
        return normalized;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
