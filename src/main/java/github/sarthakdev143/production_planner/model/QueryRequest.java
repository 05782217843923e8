package github.sarthakdev143.production_planner.model;

import java.util.List;

/**
 * A normalized creative request, as accepted at the service boundary.
 */
public record QueryRequest(
        String userId,
        String prompt,
        QueryConstraints constraints,
        List<InputAsset> assets,
        List<SceneOutline> sceneOutline) {

    public QueryRequest {
        assets = assets == null ? List.of() : List.copyOf(assets);
        sceneOutline = sceneOutline == null ? List.of() : List.copyOf(sceneOutline);
    }
}
