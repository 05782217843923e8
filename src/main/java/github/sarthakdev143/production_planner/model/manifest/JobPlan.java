package github.sarthakdev143.production_planner.model.manifest;

import github.sarthakdev143.production_planner.model.JobType;

import java.util.List;
import java.util.Map;

/**
 * A unit of generation work. The payload is opaque to validation and scheduling.
 */
public record JobPlan(
        String id,
        JobType type,
        Map<String, Object> payload,
        List<String> dependsOn,
        int priority,
        String resultAssetId,
        RetryPolicy retryPolicy) {

    public JobPlan {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        retryPolicy = retryPolicy == null ? RetryPolicy.DEFAULT : retryPolicy;
    }
}
