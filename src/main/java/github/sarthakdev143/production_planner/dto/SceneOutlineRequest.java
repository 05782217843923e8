package github.sarthakdev143.production_planner.dto;

public record SceneOutlineRequest(
        String title,
        String narration,
        Integer durationWeight,
        String assetId) {
}
