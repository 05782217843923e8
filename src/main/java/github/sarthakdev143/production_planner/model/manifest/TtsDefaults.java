package github.sarthakdev143.production_planner.model.manifest;

public record TtsDefaults(
        String provider,
        String voiceId,
        String format) {
}
