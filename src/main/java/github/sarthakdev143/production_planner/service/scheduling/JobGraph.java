package github.sarthakdev143.production_planner.service.scheduling;

import github.sarthakdev143.production_planner.model.manifest.JobPlan;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Acyclic job dependency graph. Only {@link JobGraphBuilder} creates instances.
 */
public final class JobGraph {

    private final Map<String, JobPlan> jobsById;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;
    private final List<String> topologicalOrder;

    JobGraph(
            Map<String, JobPlan> jobsById,
            Map<String, List<String>> dependencies,
            Map<String, List<String>> dependents,
            List<String> topologicalOrder) {
        this.jobsById = jobsById;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.topologicalOrder = topologicalOrder;
    }

    public JobPlan job(String jobId) {
        JobPlan job = jobsById.get(jobId);
        if (job == null) {
            throw new IllegalArgumentException("Unknown job id: " + jobId);
        }
        return job;
    }

    public boolean contains(String jobId) {
        return jobsById.containsKey(jobId);
    }

    public Collection<JobPlan> jobs() {
        return jobsById.values();
    }

    public Set<String> jobIds() {
        return jobsById.keySet();
    }

    public List<String> dependenciesOf(String jobId) {
        return dependencies.getOrDefault(jobId, List.of());
    }

    public List<String> dependentsOf(String jobId) {
        return dependents.getOrDefault(jobId, List.of());
    }

    /**
     * Job ids ordered so that every job appears after all of its dependencies.
     */
    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    public int size() {
        return jobsById.size();
    }
}
