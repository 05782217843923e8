package github.sarthakdev143.production_planner.model.manifest;

import java.math.BigDecimal;

public record MusicCue(
        String id,
        BigDecimal startSec,
        BigDecimal durationSec,
        String mood,
        String assetId) {
}
