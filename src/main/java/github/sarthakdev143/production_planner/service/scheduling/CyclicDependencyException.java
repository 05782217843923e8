package github.sarthakdev143.production_planner.service.scheduling;

import java.util.List;

public class CyclicDependencyException extends IllegalArgumentException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Job dependencies contain a cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
