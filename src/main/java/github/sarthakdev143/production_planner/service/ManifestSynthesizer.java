package github.sarthakdev143.production_planner.service;

import github.sarthakdev143.production_planner.model.AssetAnalysisResult;
import github.sarthakdev143.production_planner.model.QueryRequest;
import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;

import java.util.Map;

/**
 * Turns a query and the analysis results of its assets into an unvalidated manifest draft.
 */
public interface ManifestSynthesizer {

    ManifestDraft synthesize(String queryId, QueryRequest request, Map<String, AssetAnalysisResult> analysisResults);
}
