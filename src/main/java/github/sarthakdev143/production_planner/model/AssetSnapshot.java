package github.sarthakdev143.production_planner.model;

import java.time.Instant;

public record AssetSnapshot(
        String assetId,
        AssetMediaType mediaType,
        AssetSource source,
        boolean required,
        AssetAnalysisStatus status,
        int progress,
        Double qualityScore,
        FailureReason failureReason,
        String errorMessage,
        Instant updatedAt) {
}
