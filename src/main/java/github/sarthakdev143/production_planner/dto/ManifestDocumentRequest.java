package github.sarthakdev143.production_planner.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Loosely-typed manifest document as exchanged with other systems. Enumerated fields arrive as
 * strings and are checked when mapped onto the model.
 */
public record ManifestDocumentRequest(
        String userId,
        List<String> sourceRefs,
        Metadata metadata,
        List<Scene> scenes,
        Map<String, Asset> assets,
        Audio audio,
        List<Job> jobs,
        List<String> warnings) {

    public record Metadata(
            BigDecimal durationSeconds,
            String aspectRatio,
            String platform,
            String language) {
    }

    public record Scene(
            String id,
            BigDecimal startAtSec,
            BigDecimal durationSeconds,
            String purpose,
            String narration,
            List<Visual> visuals,
            String musicCue) {
    }

    public record Visual(
            String assetId,
            String role) {
    }

    public record Asset(
            String id,
            String type,
            String source,
            String role,
            String originUrl,
            Boolean required,
            String status) {
    }

    public record Audio(
            TtsDefaults ttsDefaults,
            Map<String, String> narration,
            Map<String, MusicCue> cueMap) {
    }

    public record TtsDefaults(
            String provider,
            String voiceId,
            String format) {
    }

    public record MusicCue(
            String id,
            BigDecimal startSec,
            BigDecimal durationSec,
            String mood,
            String assetId) {
    }

    public record Job(
            String id,
            String type,
            Map<String, Object> payload,
            List<String> dependsOn,
            Integer priority,
            String resultAssetId,
            RetryPolicy retryPolicy) {
    }

    public record RetryPolicy(
            Integer maxRetries,
            Integer backoffSeconds) {
    }
}
