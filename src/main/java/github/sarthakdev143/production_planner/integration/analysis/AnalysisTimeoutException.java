package github.sarthakdev143.production_planner.integration.analysis;

import java.time.Duration;

public class AnalysisTimeoutException extends AssetAnalysisException {

    public AnalysisTimeoutException(String assetId, Duration timeout) {
        super("Analysis of asset " + assetId + " timed out after " + timeout.toMillis() + " ms.");
    }
}
