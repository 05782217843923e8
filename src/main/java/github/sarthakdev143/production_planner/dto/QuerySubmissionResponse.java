package github.sarthakdev143.production_planner.dto;

import github.sarthakdev143.production_planner.model.QueryStatus;

public record QuerySubmissionResponse(
        String queryId,
        QueryStatus status,
        String message) {
}
