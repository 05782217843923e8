package github.sarthakdev143.production_planner.service.impl;

/**
 * Coordinates one analysis call with the watchdog that enforces its deadline. Once the worker has
 * finished the watchdog does nothing; an interrupt raised after the watchdog claimed the timeout is
 * cleared when the worker finishes.
 */
final class AnalysisDeadline {

    private final Thread worker;
    private boolean finished;
    private boolean expired;

    AnalysisDeadline(Thread worker) {
        this.worker = worker;
    }

    /**
     * Called by the watchdog. Returns false when the worker already finished.
     */
    synchronized boolean claimTimeout() {
        if (finished) {
            return false;
        }
        expired = true;
        return true;
    }

    synchronized void interruptWorker() {
        if (!finished) {
            worker.interrupt();
        }
    }

    /**
     * Called by the worker on its own thread once the provider call is over. Clears an interrupt
     * raised by the watchdog so the pooled thread is handed back clean.
     */
    synchronized void finish() {
        finished = true;
        if (expired) {
            Thread.interrupted();
        }
    }
}
