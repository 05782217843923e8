package github.sarthakdev143.production_planner.model.manifest;

import github.sarthakdev143.production_planner.model.AssetMediaType;
import github.sarthakdev143.production_planner.model.AssetSource;

public record AssetPlan(
        String id,
        AssetMediaType mediaType,
        AssetSource source,
        String role,
        String originUrl,
        boolean required,
        boolean ready,
        Double qualityScore) {
}
