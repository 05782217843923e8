package github.sarthakdev143.production_planner.model;

import java.math.BigDecimal;

public record QueryConstraints(
        BigDecimal durationSeconds,
        String aspectRatio,
        String platform,
        String language) {
}
