package github.sarthakdev143.production_planner.model.manifest;

import java.math.BigDecimal;

public record ManifestMetadata(
        BigDecimal durationSeconds,
        String aspectRatio,
        String platform,
        String language) {
}
