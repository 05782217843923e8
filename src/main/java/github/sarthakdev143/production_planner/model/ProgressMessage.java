package github.sarthakdev143.production_planner.model;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable progress event. {@code sequence} is 1-based and gap-free within a query.
 */
public record ProgressMessage(
        String id,
        String queryId,
        long sequence,
        Instant timestamp,
        ProgressMessageType type,
        String assetId,
        String content,
        Map<String, Object> payload) {

    public ProgressMessage {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
