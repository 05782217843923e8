package github.sarthakdev143.production_planner.model;

import java.time.Instant;
import java.util.List;

public record QuerySnapshot(
        String queryId,
        String userId,
        String prompt,
        QueryConstraints constraints,
        QueryStatus status,
        int progress,
        FailureReason failureReason,
        List<String> failureDetails,
        Instant createdAt,
        Instant updatedAt,
        List<AssetSnapshot> assets,
        List<ProgressMessage> messages) {

    public QuerySnapshot {
        failureDetails = failureDetails == null ? List.of() : List.copyOf(failureDetails);
        assets = assets == null ? List.of() : List.copyOf(assets);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
