package github.sarthakdev143.production_planner.model.manifest;

public record RetryPolicy(
        int maxRetries,
        int backoffSeconds) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, 30);
}
