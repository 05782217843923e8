package github.sarthakdev143.production_planner.service.progress;

import github.sarthakdev143.production_planner.model.AssetAnalysisResult;
import github.sarthakdev143.production_planner.model.AssetAnalysisStatus;
import github.sarthakdev143.production_planner.model.AssetSnapshot;
import github.sarthakdev143.production_planner.model.FailureReason;
import github.sarthakdev143.production_planner.model.InputAsset;
import github.sarthakdev143.production_planner.model.ProgressMessageType;
import github.sarthakdev143.production_planner.model.QueryRequest;
import github.sarthakdev143.production_planner.model.QuerySnapshot;
import github.sarthakdev143.production_planner.model.QueryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * State machine for one query and the analysis of each of its assets.
 *
 * <p>Query: {@code pending -> analyzing -> merging -> completed | failed}. Asset:
 * {@code queued -> running -> completed | failed | cancelled}. Every transition appends exactly one
 * message to the query's progress log; the tracker is that log's only writer. Reports that arrive
 * after the query is terminal, or that do not match the asset's current state, are ignored and
 * return {@code false}.
 *
 * <p>Overall progress is 10 + 70 x (terminal assets / total assets) while analyzing, 90 while
 * merging and 100 only on completion. It never decreases.
 */
public class ProgressTracker {

    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);
    private static final int ANALYZING_BASE_PROGRESS = 10;
    private static final int ANALYZING_PROGRESS_SPAN = 70;
    private static final int MERGING_PROGRESS = 90;
    private static final int COMPLETED_PROGRESS = 100;

    private final String queryId;
    private final QueryRequest request;
    private final ProgressLog log;
    private final Clock clock;
    private final Consumer<ProgressTracker> mergeListener;
    private final Object lock = new Object();
    private final Map<String, AssetState> assets = new LinkedHashMap<>();
    private final Instant createdAt;
    private QueryStatus status = QueryStatus.PENDING;
    private int progress;
    private FailureReason failureReason;
    private List<String> failureDetails = List.of();
    private Instant updatedAt;

    public ProgressTracker(
            String queryId,
            QueryRequest request,
            ProgressLog log,
            Clock clock,
            Consumer<ProgressTracker> mergeListener) {
        this.queryId = queryId;
        this.request = request;
        this.log = log;
        this.clock = clock;
        this.mergeListener = mergeListener;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        for (InputAsset asset : request.assets()) {
            if (assets.putIfAbsent(asset.id(), new AssetState(asset, createdAt)) != null) {
                throw new IllegalArgumentException("Asset id " + asset.id() + " is declared more than once.");
            }
        }
    }

    public String queryId() {
        return queryId;
    }

    public QueryRequest request() {
        return request;
    }

    /**
     * Moves the query from pending to analyzing. A query without assets goes straight on to merging.
     */
    public boolean start() {
        boolean merging;
        synchronized (lock) {
            if (status != QueryStatus.PENDING) {
                return false;
            }
            status = QueryStatus.ANALYZING;
            raiseProgress(ANALYZING_BASE_PROGRESS);
            append(ProgressMessageType.STATUS, null,
                    "Analyzing " + assets.size() + " assets in parallel...",
                    Map.of("status", status.toApiValue(), "progress", progress, "assetCount", assets.size()));
            merging = enterMergingIfAllTerminal();
        }
        notifyMerging(merging);
        return true;
    }

    public boolean assetStarted(String assetId) {
        synchronized (lock) {
            AssetState asset = acceptingAsset(assetId, AssetAnalysisStatus.QUEUED);
            if (asset == null) {
                return false;
            }
            asset.status = AssetAnalysisStatus.RUNNING;
            asset.updatedAt = touch();
            append(ProgressMessageType.ASSET_START, assetId,
                    "Analyzing " + asset.input.mediaType().toApiValue() + " asset " + assetId + "...",
                    Map.of("status", asset.status.toApiValue()));
            return true;
        }
    }

    /**
     * Records intermediate progress for a running asset. Values are clamped to 0..99 and never go back.
     */
    public boolean assetProgress(String assetId, int percent) {
        synchronized (lock) {
            AssetState asset = acceptingAsset(assetId, AssetAnalysisStatus.RUNNING);
            if (asset == null) {
                return false;
            }
            int clamped = Math.max(0, Math.min(99, percent));
            if (clamped <= asset.progress) {
                return false;
            }
            asset.progress = clamped;
            asset.updatedAt = touch();
            append(ProgressMessageType.ASSET_PROGRESS, assetId,
                    "Asset " + assetId + " analysis " + clamped + "% complete",
                    Map.of("progress", clamped));
            return true;
        }
    }

    public boolean assetCompleted(String assetId, AssetAnalysisResult result) {
        boolean merging;
        synchronized (lock) {
            AssetState asset = acceptingAsset(assetId, AssetAnalysisStatus.RUNNING);
            if (asset == null) {
                return false;
            }
            asset.status = AssetAnalysisStatus.COMPLETED;
            asset.progress = COMPLETED_PROGRESS;
            asset.result = result;
            asset.qualityScore = result.qualityScore();
            asset.updatedAt = touch();
            raiseProgress(analyzingProgress());
            append(ProgressMessageType.ASSET_COMPLETE, assetId,
                    "Asset " + assetId + " analyzed (quality " + Math.round(result.qualityScore() * 100) + "%)",
                    Map.of("qualityScore", result.qualityScore(), "progress", progress));
            merging = enterMergingIfAllTerminal();
        }
        notifyMerging(merging);
        return true;
    }

    /**
     * Fails one asset. A required asset fails the whole query; an optional one only itself.
     */
    public boolean assetFailed(String assetId, FailureReason reason, String errorMessage) {
        boolean merging = false;
        synchronized (lock) {
            AssetState asset = assets.get(assetId);
            if (asset == null || status != QueryStatus.ANALYZING || asset.status.isTerminal()) {
                return false;
            }
            asset.status = AssetAnalysisStatus.FAILED;
            asset.failureReason = reason;
            asset.errorMessage = errorMessage;
            asset.updatedAt = touch();
            raiseProgress(analyzingProgress());
            append(ProgressMessageType.ERROR, assetId,
                    "Asset " + assetId + " analysis failed: " + errorMessage,
                    errorPayload(reason, asset.input.required()));

            if (asset.input.required()) {
                failLocked(FailureReason.REQUIRED_ASSET_FAILED,
                        List.of("required asset " + assetId + " failed: " + reason.toApiValue()));
            } else {
                logger.info("Optional asset {} of query {} failed reason={}", assetId, queryId, reason);
                merging = enterMergingIfAllTerminal();
            }
        }
        notifyMerging(merging);
        return true;
    }

    /**
     * Moves a merging query to completed with 100% progress.
     */
    public boolean complete(String content, Map<String, Object> payload) {
        synchronized (lock) {
            if (status != QueryStatus.MERGING) {
                return false;
            }
            status = QueryStatus.COMPLETED;
            raiseProgress(COMPLETED_PROGRESS);
            touch();
            Map<String, Object> finalPayload = new LinkedHashMap<>(payload == null ? Map.of() : payload);
            finalPayload.put("status", status.toApiValue());
            finalPayload.put("progress", progress);
            append(ProgressMessageType.FINAL, null, content, finalPayload);
            log.close();
            return true;
        }
    }

    public boolean fail(FailureReason reason, List<String> details) {
        synchronized (lock) {
            if (status.isTerminal()) {
                return false;
            }
            failLocked(reason, details);
            return true;
        }
    }

    /**
     * Stops accepting results, cancels every asset still queued or running and fails the query.
     */
    public boolean cancel() {
        synchronized (lock) {
            if (status.isTerminal()) {
                return false;
            }
            for (AssetState asset : assets.values()) {
                if (!asset.status.isTerminal()) {
                    asset.status = AssetAnalysisStatus.CANCELLED;
                    asset.failureReason = FailureReason.CANCELLED;
                    asset.errorMessage = "Analysis cancelled.";
                    asset.updatedAt = touch();
                    append(ProgressMessageType.ERROR, asset.input.id(),
                            "Asset " + asset.input.id() + " analysis cancelled",
                            errorPayload(FailureReason.CANCELLED, asset.input.required()));
                }
            }
            failLocked(FailureReason.CANCELLED, List.of("query cancelled"));
            return true;
        }
    }

    public QueryStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    public Instant updatedAt() {
        synchronized (lock) {
            return updatedAt;
        }
    }

    public boolean isAccepting() {
        synchronized (lock) {
            return !status.isTerminal();
        }
    }

    public AssetAnalysisStatus assetStatus(String assetId) {
        synchronized (lock) {
            AssetState asset = assets.get(assetId);
            if (asset == null) {
                throw new IllegalArgumentException("Unknown asset id " + assetId + " for query " + queryId + ".");
            }
            return asset.status;
        }
    }

    /**
     * Analysis results of completed assets, in declaration order.
     */
    public Map<String, AssetAnalysisResult> completedResults() {
        synchronized (lock) {
            Map<String, AssetAnalysisResult> results = new LinkedHashMap<>();
            assets.forEach((id, asset) -> {
                if (asset.result != null) {
                    results.put(id, asset.result);
                }
            });
            return results;
        }
    }

    public QuerySnapshot snapshot() {
        synchronized (lock) {
            List<AssetSnapshot> assetSnapshots = new ArrayList<>();
            for (AssetState asset : assets.values()) {
                assetSnapshots.add(new AssetSnapshot(
                        asset.input.id(),
                        asset.input.mediaType(),
                        asset.input.source(),
                        asset.input.required(),
                        asset.status,
                        asset.progress,
                        asset.qualityScore,
                        asset.failureReason,
                        asset.errorMessage,
                        asset.updatedAt));
            }
            return new QuerySnapshot(
                    queryId,
                    request.userId(),
                    request.prompt(),
                    request.constraints(),
                    status,
                    progress,
                    failureReason,
                    failureDetails,
                    createdAt,
                    updatedAt,
                    assetSnapshots,
                    log.after(0L));
        }
    }

    private void failLocked(FailureReason reason, List<String> details) {
        status = QueryStatus.FAILED;
        failureReason = reason;
        failureDetails = details == null ? List.of() : List.copyOf(details);
        touch();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status.toApiValue());
        payload.put("reason", reason.toApiValue());
        payload.put("details", failureDetails);
        append(ProgressMessageType.ERROR, null, "Query failed: " + reason.toApiValue(), payload);
        log.close();
        logger.warn("Query {} failed reason={} details={}", queryId, reason, failureDetails);
    }

    private boolean enterMergingIfAllTerminal() {
        if (status != QueryStatus.ANALYZING) {
            return false;
        }
        boolean allTerminal = assets.values().stream().allMatch(asset -> asset.status.isTerminal());
        if (!allTerminal) {
            return false;
        }
        status = QueryStatus.MERGING;
        raiseProgress(MERGING_PROGRESS);
        touch();
        long completed = assets.values().stream()
                .filter(asset -> asset.status == AssetAnalysisStatus.COMPLETED)
                .count();
        append(ProgressMessageType.MERGE, null,
                "All assets analyzed; merging " + completed + " of " + assets.size() + " results",
                Map.of("status", status.toApiValue(), "progress", progress, "completedAssets", completed));
        return true;
    }

    private void notifyMerging(boolean merging) {
        if (merging && mergeListener != null) {
            mergeListener.accept(this);
        }
    }

    private AssetState acceptingAsset(String assetId, AssetAnalysisStatus expected) {
        AssetState asset = assets.get(assetId);
        if (asset == null || status != QueryStatus.ANALYZING || asset.status != expected) {
            return null;
        }
        return asset;
    }

    private int analyzingProgress() {
        if (assets.isEmpty()) {
            return ANALYZING_BASE_PROGRESS + ANALYZING_PROGRESS_SPAN;
        }
        long terminal = assets.values().stream().filter(asset -> asset.status.isTerminal()).count();
        return ANALYZING_BASE_PROGRESS + (int) (ANALYZING_PROGRESS_SPAN * terminal / assets.size());
    }

    private void raiseProgress(int candidate) {
        progress = Math.max(progress, candidate);
    }

    private Instant touch() {
        updatedAt = clock.instant();
        return updatedAt;
    }

    private Map<String, Object> errorPayload(FailureReason reason, boolean required) {
        return Map.of("reason", reason.toApiValue(), "required", required);
    }

    private void append(ProgressMessageType type, String assetId, String content, Map<String, Object> payload) {
        log.append(type, assetId, content, payload);
    }

    private static final class AssetState {
        private final InputAsset input;
        private AssetAnalysisStatus status = AssetAnalysisStatus.QUEUED;
        private int progress;
        private Double qualityScore;
        private AssetAnalysisResult result;
        private FailureReason failureReason;
        private String errorMessage;
        private Instant updatedAt;

        private AssetState(InputAsset input, Instant createdAt) {
            this.input = input;
            this.updatedAt = createdAt;
        }
    }
}
