package github.sarthakdev143.production_planner.integration.analysis;

@FunctionalInterface
public interface AnalysisProgressListener {

    void onProgress(int percent);
}
