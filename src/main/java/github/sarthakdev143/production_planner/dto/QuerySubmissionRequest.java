package github.sarthakdev143.production_planner.dto;

import java.util.List;

public record QuerySubmissionRequest(
        String userId,
        String prompt,
        QueryConstraintsRequest constraints,
        List<AssetSubmissionRequest> assets,
        List<SceneOutlineRequest> scenes) {
}
