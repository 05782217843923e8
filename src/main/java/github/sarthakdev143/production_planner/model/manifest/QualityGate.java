package github.sarthakdev143.production_planner.model.manifest;

public record QualityGate(
        boolean durationCompliance,
        boolean requiredAssetsReady) {
}
