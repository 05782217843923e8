package github.sarthakdev143.production_planner.model;

public record SceneOutline(
        String title,
        String narration,
        int durationWeight,
        String assetId) {
}
