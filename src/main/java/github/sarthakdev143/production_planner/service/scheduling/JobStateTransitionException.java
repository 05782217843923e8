package github.sarthakdev143.production_planner.service.scheduling;

import github.sarthakdev143.production_planner.model.JobState;

public class JobStateTransitionException extends IllegalStateException {

    private final String jobId;
    private final JobState currentState;
    private final JobState requestedState;

    public JobStateTransitionException(String jobId, JobState currentState, JobState requestedState) {
        super("Job " + jobId + " cannot move from " + currentState.toApiValue()
                + " to " + requestedState.toApiValue() + ".");
        this.jobId = jobId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getCurrentState() {
        return currentState;
    }

    public JobState getRequestedState() {
        return requestedState;
    }
}
