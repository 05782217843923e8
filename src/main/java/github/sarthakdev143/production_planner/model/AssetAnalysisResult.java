package github.sarthakdev143.production_planner.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Structured analysis returned by an analysis provider for a single asset.
 *
 * @param durationSeconds media length for audio and video, {@code null} for stills
 * @param qualityScore    0.0 to 1.0
 */
public record AssetAnalysisResult(
        String assetId,
        AssetMediaType mediaType,
        BigDecimal durationSeconds,
        Integer width,
        Integer height,
        double qualityScore,
        String summary,
        Map<String, Object> attributes) {

    public AssetAnalysisResult {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
