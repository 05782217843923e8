package github.sarthakdev143.production_planner.model.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Every structural problem found in one manifest draft, grouped by error class.
 */
public record ValidationReport(
        List<TimelineViolation> timelineViolations,
        Set<DanglingReference> danglingReferences,
        List<String> cycle) {

    public ValidationReport {
        timelineViolations = timelineViolations == null ? List.of() : List.copyOf(timelineViolations);
        danglingReferences = danglingReferences == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(danglingReferences));
        cycle = cycle == null ? List.of() : List.copyOf(cycle);
    }

    public boolean valid() {
        return timelineViolations.isEmpty() && danglingReferences.isEmpty() && cycle.isEmpty();
    }

    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        timelineViolations.forEach(violation -> lines.add(violation.message()));
        danglingReferences.stream()
                .map(DanglingReference::describe)
                .sorted()
                .forEach(lines::add);
        if (!cycle.isEmpty()) {
            lines.add("job dependency cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0));
        }
        return lines;
    }
}
