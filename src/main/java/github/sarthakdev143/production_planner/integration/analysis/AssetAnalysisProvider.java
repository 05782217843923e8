package github.sarthakdev143.production_planner.integration.analysis;

import github.sarthakdev143.production_planner.model.AssetAnalysisResult;
import github.sarthakdev143.production_planner.model.InputAsset;

import java.time.Duration;

public interface AssetAnalysisProvider {

    /**
     * Analyzes one asset, blocking until done. Implementations must give up after {@code timeout}
     * and throw {@link AnalysisTimeoutException}.
     */
    AssetAnalysisResult analyze(InputAsset asset, Duration timeout, AnalysisProgressListener progressListener)
            throws AssetAnalysisException, InterruptedException;
}
