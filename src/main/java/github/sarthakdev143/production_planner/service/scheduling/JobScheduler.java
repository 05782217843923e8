package github.sarthakdev143.production_planner.service.scheduling;

import github.sarthakdev143.production_planner.model.JobState;
import github.sarthakdev143.production_planner.model.manifest.JobPlan;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Tracks job states for one manifest and vends jobs whose dependencies have all succeeded.
 *
 * <p>The scheduler is the only writer of job state; every mutation happens under {@code lock}.
 * Ready jobs are placed on a queue exactly once and are moved to {@link JobState#DISPATCHED}
 * when a dispatcher takes them, so no job is handed out twice. The scheduler never runs a job.
 */
public class JobScheduler {

    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final String planId;
    private final JobGraph graph;
    private final Object lock = new Object();
    private final Map<String, JobState> states = new LinkedHashMap<>();
    private final Map<String, Integer> unfinishedDependencies = new HashMap<>();
    private final BlockingQueue<JobPlan> readyQueue = new LinkedBlockingQueue<>();
    private final Counter dispatchedCounter;
    private final Counter succeededCounter;
    private final Counter failedCounter;
    private final Counter blockedCounter;

    public JobScheduler(String planId, JobGraph graph, MeterRegistry meterRegistry) {
        this.planId = planId;
        this.graph = graph;
        this.dispatchedCounter = meterRegistry.counter("production_planner.jobs.dispatched");
        this.succeededCounter = meterRegistry.counter("production_planner.jobs.succeeded");
        this.failedCounter = meterRegistry.counter("production_planner.jobs.failed");
        this.blockedCounter = meterRegistry.counter("production_planner.jobs.blocked");

        synchronized (lock) {
            for (String jobId : graph.topologicalOrder()) {
                int dependencyCount = graph.dependenciesOf(jobId).size();
                unfinishedDependencies.put(jobId, dependencyCount);
                states.put(jobId, JobState.PENDING);
                if (dependencyCount == 0) {
                    makeReady(jobId);
                }
            }
        }
        logger.info("Created job scheduler for plan {} jobs={} initiallyReady={}", planId, graph.size(), readyQueue.size());
    }

    public String planId() {
        return planId;
    }

    /**
     * Waits up to {@code timeout} for the next ready job and marks it dispatched.
     */
    public Optional<JobPlan> pollReady(Duration timeout) throws InterruptedException {
        JobPlan job = readyQueue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (job == null) {
            return Optional.empty();
        }
        dispatch(job);
        return Optional.of(job);
    }

    /**
     * Takes every job that is ready right now and marks each dispatched.
     */
    public List<JobPlan> drainReady() {
        List<JobPlan> drained = new ArrayList<>();
        readyQueue.drainTo(drained);
        drained.forEach(this::dispatch);
        return drained;
    }

    /**
     * @return {@code true} if the job moved to succeeded, {@code false} if it already had
     * @throws JobStateTransitionException if the job is not dispatched or already ended differently
     */
    public boolean markSucceeded(String jobId) {
        synchronized (lock) {
            JobState current = requireState(jobId);
            if (current == JobState.SUCCEEDED) {
                return false;
            }
            if (current != JobState.DISPATCHED) {
                throw new JobStateTransitionException(jobId, current, JobState.SUCCEEDED);
            }

            states.put(jobId, JobState.SUCCEEDED);
            succeededCounter.increment();
            for (String dependent : graph.dependentsOf(jobId)) {
                int remaining = unfinishedDependencies.merge(dependent, -1, Integer::sum);
                if (remaining == 0 && states.get(dependent) == JobState.PENDING) {
                    makeReady(dependent);
                }
            }
        }
        logger.debug("Job {} in plan {} succeeded", jobId, planId);
        return true;
    }

    /**
     * Marks the job failed and blocks every job that depends on it, directly or transitively.
     *
     * @return {@code true} if the job moved to failed, {@code false} if it already had
     * @throws JobStateTransitionException if the job is not dispatched or already ended differently
     */
    public boolean markFailed(String jobId) {
        List<String> blocked = new ArrayList<>();
        synchronized (lock) {
            JobState current = requireState(jobId);
            if (current == JobState.FAILED) {
                return false;
            }
            if (current != JobState.DISPATCHED) {
                throw new JobStateTransitionException(jobId, current, JobState.FAILED);
            }

            states.put(jobId, JobState.FAILED);
            failedCounter.increment();

            Deque<String> frontier = new ArrayDeque<>(graph.dependentsOf(jobId));
            while (!frontier.isEmpty()) {
                String dependent = frontier.poll();
                if (states.get(dependent) != JobState.PENDING) {
                    continue;
                }
                states.put(dependent, JobState.BLOCKED);
                blocked.add(dependent);
                frontier.addAll(graph.dependentsOf(dependent));
            }
            blockedCounter.increment(blocked.size());
        }
        logger.warn("Job {} in plan {} failed; blocked dependents={}", jobId, planId, blocked);
        return true;
    }

    public JobState state(String jobId) {
        synchronized (lock) {
            return requireState(jobId);
        }
    }

    public Map<String, JobState> snapshot() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(states));
        }
    }

    public PlanStatus status() {
        synchronized (lock) {
            boolean allSucceeded = true;
            for (JobState state : states.values()) {
                if (state == JobState.FAILED || state == JobState.BLOCKED) {
                    return PlanStatus.FAILED;
                }
                if (state != JobState.SUCCEEDED) {
                    allSucceeded = false;
                }
            }
            return allSucceeded ? PlanStatus.SUCCEEDED : PlanStatus.RUNNING;
        }
    }

    /**
     * @return {@code true} once no job can change state any more
     */
    public boolean isSettled() {
        synchronized (lock) {
            return states.values().stream().allMatch(JobState::isTerminal);
        }
    }

    public JobGraph graph() {
        return graph;
    }

    private void dispatch(JobPlan job) {
        synchronized (lock) {
            JobState current = states.get(job.id());
            if (current != JobState.READY) {
                throw new JobStateTransitionException(job.id(), current, JobState.DISPATCHED);
            }
            states.put(job.id(), JobState.DISPATCHED);
        }
        dispatchedCounter.increment();
        logger.debug("Dispatched job {} type={} in plan {}", job.id(), job.type().toApiValue(), planId);
    }

    private void makeReady(String jobId) {
        states.put(jobId, JobState.READY);
        readyQueue.add(graph.job(jobId));
    }

    private JobState requireState(String jobId) {
        JobState state = states.get(jobId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown job id " + jobId + " for plan " + planId + ".");
        }
        return state;
    }
}
