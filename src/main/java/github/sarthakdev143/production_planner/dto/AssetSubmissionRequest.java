package github.sarthakdev143.production_planner.dto;

public record AssetSubmissionRequest(
        String id,
        String type,
        String source,
        String url,
        String description,
        Boolean optional) {
}
