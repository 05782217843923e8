package github.sarthakdev143.production_planner.service.scheduling;

import github.sarthakdev143.production_planner.model.manifest.JobPlan;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the job dependency graph from declared {@code dependsOn} edges.
 *
 * <p>Cycle detection is a depth-first traversal with three colours. Edges point from a job to the
 * jobs it depends on. Jobs and edges are visited in declaration order, so the reported cycle is
 * deterministic for a given job list. Payloads are never inspected.
 */
@Component
public class JobGraphBuilder {

    private enum Colour {
        UNVISITED,
        IN_PROGRESS,
        DONE
    }

    public JobGraph build(List<JobPlan> jobs) {
        Map<String, JobPlan> jobsById = indexJobs(jobs);

        for (JobPlan job : jobsById.values()) {
            for (String dependency : job.dependsOn()) {
                if (!jobsById.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                            "Job " + job.id() + " depends on unknown job " + dependency + ".");
                }
            }
        }

        Traversal traversal = traverse(jobsById);
        if (traversal.cycle() != null) {
            throw new CyclicDependencyException(traversal.cycle());
        }

        Map<String, List<String>> dependencies = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (JobPlan job : jobsById.values()) {
            List<String> distinctDependencies = job.dependsOn().stream().distinct().toList();
            dependencies.put(job.id(), distinctDependencies);
            for (String dependency : distinctDependencies) {
                dependents.computeIfAbsent(dependency, ignored -> new ArrayList<>()).add(job.id());
            }
        }
        dependents.replaceAll((ignored, list) -> List.copyOf(list));

        return new JobGraph(
                Collections.unmodifiableMap(jobsById),
                Map.copyOf(dependencies),
                Map.copyOf(dependents),
                List.copyOf(traversal.postOrder()));
    }

    /**
     * Returns the first dependency cycle found, or empty when the jobs form a DAG. Dependencies on
     * undeclared jobs are ignored here; the reference resolver reports them.
     */
    public Optional<List<String>> findCycle(List<JobPlan> jobs) {
        Map<String, JobPlan> jobsById = new LinkedHashMap<>();
        for (JobPlan job : jobs) {
            jobsById.putIfAbsent(job.id(), job);
        }
        return Optional.ofNullable(traverse(jobsById).cycle());
    }

    private Map<String, JobPlan> indexJobs(List<JobPlan> jobs) {
        Map<String, JobPlan> jobsById = new LinkedHashMap<>();
        for (JobPlan job : jobs) {
            if (job.id() == null || job.id().isBlank()) {
                throw new IllegalArgumentException("Every job requires an id.");
            }
            if (jobsById.putIfAbsent(job.id(), job) != null) {
                throw new IllegalArgumentException("Job id " + job.id() + " is declared more than once.");
            }
        }
        return jobsById;
    }

    private Traversal traverse(Map<String, JobPlan> jobsById) {
        Map<String, Colour> colours = new HashMap<>();
        jobsById.keySet().forEach(id -> colours.put(id, Colour.UNVISITED));
        List<String> postOrder = new ArrayList<>(jobsById.size());

        for (String root : jobsById.keySet()) {
            if (colours.get(root) != Colour.UNVISITED) {
                continue;
            }

            // Explicit stack so long dependency chains cannot overflow the thread stack.
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            colours.put(root, Colour.IN_PROGRESS);
            stack.push(new Frame(root, jobsById.get(root).dependsOn()));
            path.add(root);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.edges.size()) {
                    String target = frame.edges.get(frame.next++);
                    Colour colour = colours.get(target);
                    if (colour == null) {
                        continue;
                    }
                    if (colour == Colour.IN_PROGRESS) {
                        return new Traversal(postOrder, List.copyOf(path.subList(path.indexOf(target), path.size())));
                    }
                    if (colour == Colour.UNVISITED) {
                        colours.put(target, Colour.IN_PROGRESS);
                        stack.push(new Frame(target, jobsById.get(target).dependsOn()));
                        path.add(target);
                    }
                } else {
                    stack.pop();
                    path.remove(path.size() - 1);
                    colours.put(frame.jobId, Colour.DONE);
                    postOrder.add(frame.jobId);
                }
            }
        }
        return new Traversal(postOrder, null);
    }

    private static final class Frame {
        private final String jobId;
        private final List<String> edges;
        private int next;

        private Frame(String jobId, List<String> edges) {
            this.jobId = jobId;
            this.edges = edges;
        }
    }

    private record Traversal(List<String> postOrder, List<String> cycle) {
    }
}
