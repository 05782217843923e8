package github.sarthakdev143.production_planner.service.scheduling;

import github.sarthakdev143.production_planner.model.JobType;
import github.sarthakdev143.production_planner.model.manifest.JobPlan;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobGraphBuilderTest {

    private final JobGraphBuilder builder = new JobGraphBuilder();

    @Test
    void buildOrdersDependenciesBeforeDependents() {
        JobGraph graph = builder.build(List.of(
                job("render", JobType.RENDER, "voice", "visual"),
                job("lipsync", JobType.LIP_SYNC, "voice"),
                job("voice", JobType.SPEECH_SYNTHESIS),
                job("visual", JobType.IMAGE_GENERATION)));

        List<String> order = graph.topologicalOrder();
        assertThat(order).containsExactlyInAnyOrder("render", "lipsync", "voice", "visual");
        assertThat(order.indexOf("voice")).isLessThan(order.indexOf("render"));
        assertThat(order.indexOf("visual")).isLessThan(order.indexOf("render"));
        assertThat(order.indexOf("voice")).isLessThan(order.indexOf("lipsync"));
        assertThat(graph.dependentsOf("voice")).containsExactly("render", "lipsync");
        assertThat(graph.dependenciesOf("render")).containsExactly("voice", "visual");
    }

    @Test
    void buildIgnoresRepeatedDependencyEntries() {
        JobGraph graph = builder.build(List.of(
                job("a", JobType.IMAGE_GENERATION),
                job("b", JobType.RENDER, "a", "a")));

        assertThat(graph.dependenciesOf("b")).containsExactly("a");
        assertThat(graph.dependentsOf("a")).containsExactly("b");
    }

    @Test
    void buildRejectsCycleWithOrderedJobIds() {
        List<JobPlan> jobs = List.of(
                job("A", JobType.IMAGE_GENERATION, "B"),
                job("B", JobType.IMAGE_ENHANCEMENT, "C"),
                job("C", JobType.VIDEO_GENERATION, "A"),
                job("D", JobType.RENDER, "A"));

        assertThatThrownBy(() -> builder.build(jobs))
                .isInstanceOf(CyclicDependencyException.class)
                .hasMessage("Job dependencies contain a cycle: A -> B -> C -> A")
                .extracting(error -> ((CyclicDependencyException) error).getCycle())
                .isEqualTo(List.of("A", "B", "C"));
    }

    @Test
    void findCycleReportsSelfDependency() {
        assertThat(builder.findCycle(List.of(job("X", JobType.RENDER, "X")))).contains(List.of("X"));
    }

    @Test
    void findCycleReturnsEmptyForDagAndIgnoresUnknownDependencies() {
        assertThat(builder.findCycle(List.of(
                job("a", JobType.IMAGE_GENERATION, "missing"),
                job("b", JobType.RENDER, "a")))).isEmpty();
    }

    @Test
    void findCycleStartsAtFirstJobOfCycleReached() {
        List<JobPlan> jobs = List.of(
                job("entry", JobType.RENDER, "p"),
                job("p", JobType.IMAGE_GENERATION, "q"),
                job("q", JobType.IMAGE_ENHANCEMENT, "p"));

        assertThat(builder.findCycle(jobs)).contains(List.of("p", "q"));
    }

    @Test
    void buildRejectsUnknownDependencyAndDuplicateIds() {
        assertThatThrownBy(() -> builder.build(List.of(job("a", JobType.RENDER, "ghost"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Job a depends on unknown job ghost.");

        assertThatThrownBy(() -> builder.build(List.of(
                job("a", JobType.RENDER),
                job("a", JobType.RENDER))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Job id a is declared more than once.");
    }

    @Test
    void buildHandlesLongDependencyChains() {
        List<JobPlan> jobs = new ArrayList<>();
        jobs.add(job("job_0", JobType.IMAGE_GENERATION));
        for (int index = 1; index < 20_000; index++) {
            jobs.add(job("job_" + index, JobType.IMAGE_ENHANCEMENT, "job_" + (index - 1)));
        }

        JobGraph graph = builder.build(jobs);

        assertThat(graph.size()).isEqualTo(20_000);
        assertThat(graph.topologicalOrder().get(0)).isEqualTo("job_0");
        assertThat(graph.topologicalOrder().get(19_999)).isEqualTo("job_19999");
    }

    private static JobPlan job(String id, JobType type, String... dependsOn) {
        return new JobPlan(id, type, Map.of(), List.of(dependsOn), 0, null, null);
    }
}
