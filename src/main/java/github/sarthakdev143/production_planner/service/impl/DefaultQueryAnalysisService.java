package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.config.PlannerProperties;
import github.sarthakdev143.production_planner.factory.JobSchedulerFactory;
import github.sarthakdev143.production_planner.integration.analysis.AnalysisTimeoutException;
import github.sarthakdev143.production_planner.integration.analysis.AssetAnalysisException;
import github.sarthakdev143.production_planner.integration.analysis.AssetAnalysisProvider;
import github.sarthakdev143.production_planner.model.AssetAnalysisResult;
import github.sarthakdev143.production_planner.model.FailureReason;
import github.sarthakdev143.production_planner.model.InputAsset;
import github.sarthakdev143.production_planner.model.QueryRequest;
import github.sarthakdev143.production_planner.model.QuerySnapshot;
import github.sarthakdev143.production_planner.model.QueryStatus;
import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;
import github.sarthakdev143.production_planner.model.manifest.ProductionManifest;
import github.sarthakdev143.production_planner.service.ManifestSynthesizer;
import github.sarthakdev143.production_planner.service.QueryAnalysisService;
import github.sarthakdev143.production_planner.service.progress.ProgressLog;
import github.sarthakdev143.production_planner.service.progress.ProgressSubscription;
import github.sarthakdev143.production_planner.service.progress.ProgressTracker;
import github.sarthakdev143.production_planner.service.progress.RealtimeBroadcaster;
import github.sarthakdev143.production_planner.service.scheduling.JobScheduler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

@Service
public class DefaultQueryAnalysisService implements QueryAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultQueryAnalysisService.class);

    private final RealtimeBroadcaster broadcaster;
    private final TaskExecutor analysisTaskExecutor;
    private final TaskScheduler taskScheduler;
    private final AssetAnalysisProvider analysisProvider;
    private final ManifestSynthesizer manifestSynthesizer;
    private final ManifestAssembler manifestAssembler;
    private final JobSchedulerFactory jobSchedulerFactory;
    private final Duration providerTimeout;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<String, ProgressTracker> trackers = new ConcurrentHashMap<>();
    private final Map<String, ProductionManifest> manifests = new ConcurrentHashMap<>();
    private final Map<String, JobScheduler> schedulers = new ConcurrentHashMap<>();
    private final Counter acceptedCounter;
    private final Counter completedCounter;

    @Autowired
    public DefaultQueryAnalysisService(
            RealtimeBroadcaster broadcaster,
            @Qualifier("analysisTaskExecutor") TaskExecutor analysisTaskExecutor,
            @Qualifier("plannerTaskScheduler") TaskScheduler taskScheduler,
            AssetAnalysisProvider analysisProvider,
            ManifestSynthesizer manifestSynthesizer,
            ManifestAssembler manifestAssembler,
            JobSchedulerFactory jobSchedulerFactory,
            PlannerProperties properties,
            MeterRegistry meterRegistry) {
        this(
                broadcaster,
                analysisTaskExecutor,
                taskScheduler,
                analysisProvider,
                manifestSynthesizer,
                manifestAssembler,
                jobSchedulerFactory,
                properties,
                meterRegistry,
                Clock.systemUTC());
    }

    public DefaultQueryAnalysisService(
            RealtimeBroadcaster broadcaster,
            TaskExecutor analysisTaskExecutor,
            TaskScheduler taskScheduler,
            AssetAnalysisProvider analysisProvider,
            ManifestSynthesizer manifestSynthesizer,
            ManifestAssembler manifestAssembler,
            JobSchedulerFactory jobSchedulerFactory,
            PlannerProperties properties,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.broadcaster = broadcaster;
        this.analysisTaskExecutor = analysisTaskExecutor;
        this.taskScheduler = taskScheduler;
        this.analysisProvider = analysisProvider;
        this.manifestSynthesizer = manifestSynthesizer;
        this.manifestAssembler = manifestAssembler;
        this.jobSchedulerFactory = jobSchedulerFactory;
        this.providerTimeout = properties.analysis().providerTimeout();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.acceptedCounter = meterRegistry.counter("production_planner.queries.accepted");
        this.completedCounter = meterRegistry.counter("production_planner.queries.completed");
    }

    @Override
    public String submit(QueryRequest request) {
        String queryId = UUID.randomUUID().toString();
        ProgressLog log = broadcaster.openLog(queryId);
        ProgressTracker tracker = new ProgressTracker(queryId, request, log, clock, this::mergeResults);
        trackers.put(queryId, tracker);
        acceptedCounter.increment();

        logger.info(
                "Accepted query {} userId={} assets={} optionalAssets={} outlinedScenes={}",
                queryId,
                request.userId(),
                request.assets().size(),
                request.assets().stream().filter(InputAsset::optional).count(),
                request.sceneOutline().size());

        tracker.start();
        for (InputAsset asset : request.assets()) {
            try {
                analysisTaskExecutor.execute(() -> analyzeAsset(tracker, asset));
            } catch (TaskRejectedException e) {
                logger.warn("Analysis of asset {} for query {} was rejected by the executor", asset.id(), queryId, e);
                recordAssetFailure(tracker, asset, FailureReason.ANALYSIS_FAILED, "Analysis capacity exhausted.");
            }
        }
        return queryId;
    }

    @Override
    public Optional<QuerySnapshot> getSnapshot(String queryId) {
        return Optional.ofNullable(trackers.get(queryId)).map(ProgressTracker::snapshot);
    }

    @Override
    public Optional<ProgressSubscription> subscribe(String queryId, long afterSequence) {
        return broadcaster.subscribe(queryId, afterSequence);
    }

    @Override
    public CancellationOutcome cancel(String queryId) {
        ProgressTracker tracker = trackers.get(queryId);
        if (tracker == null) {
            return CancellationOutcome.NOT_FOUND;
        }
        if (!tracker.cancel()) {
            return CancellationOutcome.ALREADY_FINISHED;
        }
        countFailure(FailureReason.CANCELLED);
        logger.info("Cancelled query {}", queryId);
        return CancellationOutcome.CANCELLED;
    }

    @Override
    public Optional<ProductionManifest> getManifest(String queryId) {
        return Optional.ofNullable(manifests.get(queryId));
    }

    @Override
    public Optional<JobScheduler> getScheduler(String queryId) {
        return Optional.ofNullable(schedulers.get(queryId));
    }

    @Override
    public int evictFinishedQueries(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (Map.Entry<String, ProgressTracker> entry : trackers.entrySet()) {
            String queryId = entry.getKey();
            ProgressTracker tracker = entry.getValue();
            if (!tracker.status().isTerminal() || tracker.updatedAt().isAfter(cutoff)) {
                continue;
            }
            if (trackers.remove(queryId, tracker)) {
                manifests.remove(queryId);
                schedulers.remove(queryId);
                broadcaster.removeLog(queryId);
                evicted++;
                logger.debug("Evicted query {} status={} updatedAt={}", queryId, tracker.status(), tracker.updatedAt());
            }
        }
        if (evicted > 0) {
            logger.info("Evicted {} finished queries last updated before {}", evicted, cutoff);
        }
        return evicted;
    }

    private void analyzeAsset(ProgressTracker tracker, InputAsset asset) {
        String queryId = tracker.queryId();
        if (!tracker.assetStarted(asset.id())) {
            logger.debug("Skipping analysis of asset {} for query {}; query no longer accepting", asset.id(), queryId);
            return;
        }

        AnalysisDeadline deadline = new AnalysisDeadline(Thread.currentThread());
        ScheduledFuture<?> watchdog;
        try {
            watchdog = taskScheduler.schedule(
                    () -> expireAnalysis(tracker, asset, deadline),
                    taskScheduler.getClock().instant().plus(providerTimeout));
        } catch (TaskRejectedException e) {
            logger.warn("Could not arm analysis deadline for asset {} in query {}", asset.id(), queryId, e);
            recordAssetFailure(tracker, asset, FailureReason.ANALYSIS_FAILED, "Analysis capacity exhausted.");
            return;
        }

        try {
            AssetAnalysisResult result = analysisProvider.analyze(
                    asset,
                    providerTimeout,
                    percent -> tracker.assetProgress(asset.id(), percent));
            if (result == null) {
                throw new AssetAnalysisException("Analysis provider returned no result for asset " + asset.id() + ".");
            }
            tracker.assetCompleted(asset.id(), result);
        } catch (AnalysisTimeoutException e) {
            logger.warn("Analysis of asset {} for query {} timed out after {}", asset.id(), queryId, providerTimeout);
            recordAssetFailure(tracker, asset, FailureReason.ANALYSIS_TIMEOUT, e.getMessage());
        } catch (AssetAnalysisException e) {
            logger.warn("Analysis of asset {} for query {} failed", asset.id(), queryId, e);
            recordAssetFailure(tracker, asset, FailureReason.ANALYSIS_FAILED, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordAssetFailure(tracker, asset, FailureReason.ANALYSIS_FAILED, "Analysis interrupted.");
        } catch (RuntimeException e) {
            logger.error("Unexpected error analyzing asset {} for query {}", asset.id(), queryId, e);
            recordAssetFailure(tracker, asset, FailureReason.ANALYSIS_FAILED, "Analysis failed. Check server logs.");
        } finally {
            watchdog.cancel(false);
            deadline.finish();
        }
    }

    /**
     * Runs on the scheduler when a provider call outlives {@code providerTimeout}. The asset is failed
     * before the worker is interrupted, so the interrupt can never be reported as a plain failure.
     */
    private void expireAnalysis(ProgressTracker tracker, InputAsset asset, AnalysisDeadline deadline) {
        if (!deadline.claimTimeout()) {
            return;
        }
        logger.warn(
                "Analysis of asset {} for query {} exceeded {}; interrupting provider",
                asset.id(),
                tracker.queryId(),
                providerTimeout);
        recordAssetFailure(
                tracker,
                asset,
                FailureReason.ANALYSIS_TIMEOUT,
                "Analysis of asset " + asset.id() + " timed out after " + providerTimeout.toMillis() + " ms.");
        deadline.interruptWorker();
    }

    private void recordAssetFailure(ProgressTracker tracker, InputAsset asset, FailureReason reason, String message) {
        if (!tracker.assetFailed(asset.id(), reason, message)) {
            return;
        }
        meterRegistry.counter("production_planner.assets.analysis_failures", "reason", reason.toApiValue()).increment();
        if (asset.required() && tracker.status() == QueryStatus.FAILED) {
            countFailure(FailureReason.REQUIRED_ASSET_FAILED);
        }
    }

    private void mergeResults(ProgressTracker tracker) {
        String queryId = tracker.queryId();
        ManifestAssembler.AssemblyResult assembly;
        try {
            ManifestDraft draft = manifestSynthesizer.synthesize(queryId, tracker.request(), tracker.completedResults());
            assembly = manifestAssembler.assemble(queryId, draft);
        } catch (RuntimeException e) {
            logger.error("Manifest synthesis failed for query {}", queryId, e);
            if (tracker.fail(FailureReason.SYNTHESIS_FAILED, List.of("Manifest synthesis failed. Check server logs."))) {
                countFailure(FailureReason.SYNTHESIS_FAILED);
            }
            return;
        }

        if (!assembly.succeeded()) {
            if (tracker.fail(FailureReason.VALIDATION_FAILED, assembly.report().describe())) {
                countFailure(FailureReason.VALIDATION_FAILED);
            }
            return;
        }

        ProductionManifest manifest = assembly.manifest();
        JobScheduler scheduler = jobSchedulerFactory.create(manifest);
        manifests.put(queryId, manifest);
        schedulers.put(queryId, scheduler);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("manifest", manifest);
        payload.put("warnings", manifest.warnings());
        String content = "Production manifest ready: " + manifest.scenes().size() + " scenes, "
                + manifest.jobs().size() + " jobs";
        if (!tracker.complete(content, payload)) {
            manifests.remove(queryId);
            schedulers.remove(queryId);
            logger.info("Query {} ended before its manifest could be published", queryId);
            return;
        }

        completedCounter.increment();
        logger.info(
                "Completed query {} scenes={} jobs={} requiredAssetsReady={} warnings={}",
                queryId,
                manifest.scenes().size(),
                manifest.jobs().size(),
                manifest.qualityGate().requiredAssetsReady(),
                manifest.warnings().size());
    }

    private void countFailure(FailureReason reason) {
        meterRegistry.counter("production_planner.queries.failed", "reason", reason.toApiValue()).increment();
    }
}
