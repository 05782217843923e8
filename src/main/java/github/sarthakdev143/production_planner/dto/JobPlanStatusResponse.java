package github.sarthakdev143.production_planner.dto;

import github.sarthakdev143.production_planner.model.JobState;
import github.sarthakdev143.production_planner.service.scheduling.PlanStatus;

import java.util.Map;

public record JobPlanStatusResponse(
        String queryId,
        PlanStatus status,
        Map<String, JobState> jobs) {
}
