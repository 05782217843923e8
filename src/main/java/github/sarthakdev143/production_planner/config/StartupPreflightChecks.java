package github.sarthakdev143.production_planner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Fails startup when the ffmpeg binary used for asset analysis cannot be found or run.
 */
@Component
@ConditionalOnProperty(name = "production-planner.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final int FFMPEG_CHECK_TIMEOUT_SECONDS = 10;

    private final PlannerProperties properties;

    public StartupPreflightChecks(PlannerProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String binary = resolveConfiguredBinary();
        if (binary != null) {
            Path ffmpegPath = Path.of(binary);
            if (!Files.isRegularFile(ffmpegPath)) {
                throw new IllegalStateException(
                        "FFmpeg binary not found at " + ffmpegPath.toAbsolutePath()
                                + ". Set production-planner.ffmpeg.path or " + FFMPEG_PATH_ENV
                                + " to a valid ffmpeg executable path.");
            }
        }

        String effectiveBinary = binary == null ? DEFAULT_FFMPEG_BINARY : binary;
        checkFfmpegRuns(effectiveBinary);
        logger.info(
                "Preflight checks passed ffmpeg={} analysisPoolSize={} providerTimeout={}",
                effectiveBinary,
                properties.analysis().poolSize(),
                properties.analysis().providerTimeout());
    }

    private String resolveConfiguredBinary() {
        String configuredPath = properties.ffmpeg().path();
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        String environmentPath = System.getenv(FFMPEG_PATH_ENV);
        if (environmentPath != null && !environmentPath.isBlank()) {
            return environmentPath;
        }
        return null;
    }

    private void checkFfmpegRuns(String binary) {
        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            boolean finished = process.waitFor(FFMPEG_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
            }
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        "FFmpeg is not available at " + binary + ". Install FFmpeg or set " + FFMPEG_PATH_ENV + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "FFmpeg is not available at " + binary + ". Install FFmpeg or set " + FFMPEG_PATH_ENV + ".",
                    e);
        }
    }
}
