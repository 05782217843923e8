package github.sarthakdev143.production_planner.model.manifest;

import java.math.BigDecimal;
import java.util.List;

public record ScenePlan(
        String id,
        BigDecimal startAtSec,
        BigDecimal durationSeconds,
        String purpose,
        String narration,
        List<SceneVisual> visuals,
        String musicCueId) {

    public ScenePlan {
        visuals = visuals == null ? List.of() : List.copyOf(visuals);
    }

    public BigDecimal endAtSec() {
        return startAtSec.add(durationSeconds);
    }
}
