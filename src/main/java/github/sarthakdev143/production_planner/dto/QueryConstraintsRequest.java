package github.sarthakdev143.production_planner.dto;

import java.math.BigDecimal;

public record QueryConstraintsRequest(
        BigDecimal durationSeconds,
        String aspectRatio,
        String platform,
        String language) {
}
