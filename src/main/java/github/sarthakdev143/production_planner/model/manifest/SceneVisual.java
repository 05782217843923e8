package github.sarthakdev143.production_planner.model.manifest;

public record SceneVisual(
        String assetId,
        String role) {
}
