package github.sarthakdev143.production_planner.integration.analysis;

public class AssetAnalysisException extends Exception {

    public AssetAnalysisException(String message) {
        super(message);
    }

    public AssetAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
