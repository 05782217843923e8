package github.sarthakdev143.production_planner.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings under {@code production-planner.*}.
 */
@ConfigurationProperties(prefix = "production-planner")
@Validated
public record PlannerProperties(
        @Valid @DefaultValue AnalysisProperties analysis,
        @Valid @DefaultValue FfmpegProperties ffmpeg,
        @Valid @DefaultValue PreflightProperties preflight,
        @Valid @DefaultValue RetentionProperties retention) {

    /**
     * @param poolSize        maximum number of assets analyzed at the same time
     * @param queueCapacity   analysis tasks waiting for a worker before submissions are rejected
     * @param providerTimeout limit for a single call to an analysis provider
     */
    public record AnalysisProperties(
            @Positive @DefaultValue("4") int poolSize,
            @Positive @DefaultValue("100") int queueCapacity,
            @NotNull @DefaultValue("30s") Duration providerTimeout) {
    }

    /**
     * @param path ffmpeg executable; blank falls back to {@code FFMPEG_PATH}, then to {@code ffmpeg} on the PATH
     */
    public record FfmpegProperties(
            @DefaultValue("") String path) {
    }

    public record PreflightProperties(
            @DefaultValue("true") boolean enabled) {
    }

    /**
     * @param finishedQueryTtl how long a completed or failed query, with its manifest, scheduler and
     *                         progress log, stays available after its last update
     * @param sweepInterval    delay between retention sweeps
     */
    public record RetentionProperties(
            @NotNull @DefaultValue("1h") Duration finishedQueryTtl,
            @NotNull @DefaultValue("5m") Duration sweepInterval) {
    }
}
