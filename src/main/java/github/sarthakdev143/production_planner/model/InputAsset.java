package github.sarthakdev143.production_planner.model;

public record InputAsset(
        String id,
        AssetMediaType mediaType,
        AssetSource source,
        String url,
        String description,
        boolean optional) {

    public boolean required() {
        return !optional;
    }
}
