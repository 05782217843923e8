package github.sarthakdev143.production_planner.service.progress;

import github.sarthakdev143.production_planner.model.ProgressMessage;
import github.sarthakdev143.production_planner.model.ProgressMessageType;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, totally ordered message log for one query. Sequence numbers start at 1 and have no gaps.
 * Messages are never removed or changed once appended.
 */
public final class ProgressLog {

    private final String queryId;
    private final Clock clock;
    private final List<ProgressMessage> messages = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean closed;

    ProgressLog(String queryId, Clock clock) {
        this.queryId = queryId;
        this.clock = clock;
    }

    public String queryId() {
        return queryId;
    }

    public ProgressMessage append(
            ProgressMessageType type,
            String assetId,
            String content,
            Map<String, Object> payload) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Progress log for query " + queryId + " is closed.");
            }
            ProgressMessage message = new ProgressMessage(
                    UUID.randomUUID().toString(),
                    queryId,
                    messages.size() + 1L,
                    clock.instant(),
                    type,
                    assetId,
                    content,
                    payload);
            messages.add(message);
            changed.signalAll();
            return message;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the log complete. Waiting readers wake up and see no further messages.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public long lastSequence() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    public List<ProgressMessage> after(long afterSequence) {
        lock.lock();
        try {
            int from = (int) Math.max(0, Math.min(afterSequence, messages.size()));
            return List.copyOf(messages.subList(from, messages.size()));
        } finally {
            lock.unlock();
        }
    }

    Optional<ProgressMessage> awaitNext(long afterSequence, Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (messages.size() <= afterSequence) {
                if (closed || remainingNanos <= 0) {
                    return Optional.empty();
                }
                remainingNanos = changed.awaitNanos(remainingNanos);
            }
            return Optional.of(messages.get((int) afterSequence));
        } finally {
            lock.unlock();
        }
    }

    boolean isExhausted(long cursor) {
        lock.lock();
        try {
            return closed && cursor >= messages.size();
        } finally {
            lock.unlock();
        }
    }
}
