package github.sarthakdev143.production_planner.service.progress;

import github.sarthakdev143.production_planner.model.ProgressMessage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A reader's cursor over one query's progress log. Each subscriber owns its cursor, so readers
 * never affect each other and a dropped reader can resume from {@link #cursor()}.
 */
public final class ProgressSubscription {

    private final ProgressLog log;
    private long cursor;

    ProgressSubscription(ProgressLog log, long afterSequence) {
        this.log = log;
        this.cursor = afterSequence;
    }

    public String queryId() {
        return log.queryId();
    }

    /**
     * Sequence number of the last message handed to this subscriber, 0 before the first.
     */
    public synchronized long cursor() {
        return cursor;
    }

    /**
     * Returns the next message, waiting up to {@code timeout} for one to be appended.
     * Returns empty on timeout or when the log is closed and fully read.
     */
    public synchronized Optional<ProgressMessage> poll(Duration timeout) throws InterruptedException {
        Optional<ProgressMessage> next = log.awaitNext(cursor, timeout);
        next.ifPresent(message -> cursor = message.sequence());
        return next;
    }

    /**
     * Returns every message appended since the cursor without waiting.
     */
    public synchronized List<ProgressMessage> drainAvailable() {
        List<ProgressMessage> available = log.after(cursor);
        if (!available.isEmpty()) {
            cursor = available.get(available.size() - 1).sequence();
        }
        return available;
    }

    /**
     * @return {@code true} when the query has finished and every message has been read
     */
    public synchronized boolean isExhausted() {
        return log.isExhausted(cursor);
    }
}
