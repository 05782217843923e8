package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.config.PlannerProperties;
import github.sarthakdev143.production_planner.service.QueryAnalysisService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically drops finished queries so that trackers, manifests, schedulers and progress logs do
 * not pile up in memory.
 */
@Component
public class QueryRetentionSweeper {

    private static final Logger logger = LoggerFactory.getLogger(QueryRetentionSweeper.class);

    private final QueryAnalysisService queryAnalysisService;
    private final TaskScheduler taskScheduler;
    private final Duration finishedQueryTtl;
    private final Duration sweepInterval;
    private ScheduledFuture<?> future;

    public QueryRetentionSweeper(
            QueryAnalysisService queryAnalysisService,
            @Qualifier("plannerTaskScheduler") TaskScheduler taskScheduler,
            PlannerProperties properties) {
        this.queryAnalysisService = queryAnalysisService;
        this.taskScheduler = taskScheduler;
        this.finishedQueryTtl = properties.retention().finishedQueryTtl();
        this.sweepInterval = properties.retention().sweepInterval();
    }

    @PostConstruct
    public void start() {
        future = taskScheduler.scheduleWithFixedDelay(this::runOnce, sweepInterval);
        logger.info("Scheduled query retention sweep every {} for queries finished more than {} ago",
                sweepInterval, finishedQueryTtl);
    }

    @PreDestroy
    public void stop() {
        if (future != null) {
            future.cancel(false);
        }
    }

    void runOnce() {
        try {
            int evicted = queryAnalysisService.evictFinishedQueries(finishedQueryTtl);
            logger.debug("Query retention sweep removed {} queries", evicted);
        } catch (RuntimeException e) {
            logger.warn("Query retention sweep failed", e);
        }
    }
}
