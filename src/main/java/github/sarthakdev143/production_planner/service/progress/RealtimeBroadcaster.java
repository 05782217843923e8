package github.sarthakdev143.production_planner.service.progress;

import github.sarthakdev143.production_planner.model.ProgressMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans out progress messages per query. Each query has one append-only log; subscribers read it
 * through independent cursors, so a late subscriber replays every earlier message before live ones
 * with no gaps and no duplicates.
 */
@Component
public class RealtimeBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeBroadcaster.class);

    private final Map<String, ProgressLog> logs = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public RealtimeBroadcaster() {
        this(Clock.systemUTC());
    }

    public RealtimeBroadcaster(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates the log for a new query. The caller becomes the log's only writer.
     */
    public ProgressLog openLog(String queryId) {
        ProgressLog log = new ProgressLog(queryId, clock);
        if (logs.putIfAbsent(queryId, log) != null) {
            throw new IllegalStateException("A progress log already exists for query " + queryId + ".");
        }
        logger.debug("Opened progress log for query {}", queryId);
        return log;
    }

    public Optional<ProgressSubscription> subscribe(String queryId) {
        return subscribe(queryId, 0L);
    }

    /**
     * Subscribes starting after {@code afterSequence}; pass the last sequence a reader saw to resume.
     */
    public Optional<ProgressSubscription> subscribe(String queryId, long afterSequence) {
        if (afterSequence < 0) {
            throw new IllegalArgumentException("afterSequence must be greater than or equal to 0.");
        }
        ProgressLog log = logs.get(queryId);
        if (log == null) {
            return Optional.empty();
        }
        return Optional.of(new ProgressSubscription(log, afterSequence));
    }

    /**
     * Drops the query's log. Subscriptions already open keep reading the messages they can reach;
     * new subscriptions find nothing.
     */
    public boolean removeLog(String queryId) {
        if (logs.remove(queryId) == null) {
            return false;
        }
        logger.debug("Removed progress log for query {}", queryId);
        return true;
    }

    public List<ProgressMessage> history(String queryId) {
        ProgressLog log = logs.get(queryId);
        return log == null ? List.of() : log.after(0L);
    }
}
