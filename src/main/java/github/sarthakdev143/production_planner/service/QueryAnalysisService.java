package github.sarthakdev143.production_planner.service;

import github.sarthakdev143.production_planner.model.QueryRequest;
import github.sarthakdev143.production_planner.model.QuerySnapshot;
import github.sarthakdev143.production_planner.model.manifest.ProductionManifest;
import github.sarthakdev143.production_planner.service.progress.ProgressSubscription;
import github.sarthakdev143.production_planner.service.scheduling.JobScheduler;

import java.time.Duration;
import java.util.Optional;

public interface QueryAnalysisService {

    /**
     * Accepts a validated request and starts analyzing its assets in the background.
     *
     * @return the new query id
     */
    String submit(QueryRequest request);

    Optional<QuerySnapshot> getSnapshot(String queryId);

    Optional<ProgressSubscription> subscribe(String queryId, long afterSequence);

    CancellationOutcome cancel(String queryId);

    /**
     * @return the assembled manifest, once the query has completed
     */
    Optional<ProductionManifest> getManifest(String queryId);

    /**
     * @return the job scheduler driving the manifest's jobs, once the query has completed
     */
    Optional<JobScheduler> getScheduler(String queryId);

    /**
     * Forgets completed and failed queries whose last update is older than {@code retention}.
     *
     * @return number of queries removed
     */
    int evictFinishedQueries(Duration retention);

    enum CancellationOutcome {
        CANCELLED,
        ALREADY_FINISHED,
        NOT_FOUND
    }
}
