package github.sarthakdev143.production_planner.integration.analysis;

import github.sarthakdev143.production_planner.config.PlannerProperties;
import github.sarthakdev143.production_planner.model.AssetAnalysisResult;
import github.sarthakdev143.production_planner.model.AssetMediaType;
import github.sarthakdev143.production_planner.model.InputAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inspects an asset URL with {@code ffmpeg -i} and derives duration, resolution and a quality score
 * from the stream description ffmpeg prints.
 */
@Component
public class FfmpegAssetAnalysisProvider implements AssetAnalysisProvider {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegAssetAnalysisProvider.class);
    private static final Pattern DURATION_PATTERN = Pattern.compile("Duration: (\\d+):(\\d+):(\\d+(?:\\.\\d+)?)");
    private static final Pattern RESOLUTION_PATTERN = Pattern.compile("Video: .*?, (\\d{2,5})x(\\d{2,5})");
    private static final Pattern SAMPLE_RATE_PATTERN = Pattern.compile("Audio: .*?, (\\d+) Hz");
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final double FULL_HD_PIXELS = 1920.0 * 1080.0;
    private static final int FULL_QUALITY_SAMPLE_RATE = 44100;

    private final PlannerProperties properties;

    public FfmpegAssetAnalysisProvider(PlannerProperties properties) {
        this.properties = properties;
    }

    @Override
    public AssetAnalysisResult analyze(InputAsset asset, Duration timeout, AnalysisProgressListener progressListener)
            throws AssetAnalysisException, InterruptedException {
        if (asset.url() == null || asset.url().isBlank()) {
            throw new AssetAnalysisException("Asset " + asset.id() + " has no url to analyze.");
        }

        progressListener.onProgress(10);
        String output = readMediaInfo(asset, timeout);
        progressListener.onProgress(60);
        return parseMediaInfo(asset, output);
    }

    AssetAnalysisResult parseMediaInfo(InputAsset asset, String output) throws AssetAnalysisException {
        BigDecimal durationSeconds = parseDuration(output);
        Map<String, Object> attributes = new LinkedHashMap<>();
        Integer width = null;
        Integer height = null;
        double qualityScore;

        if (asset.mediaType() == AssetMediaType.AUDIO) {
            if (durationSeconds == null) {
                throw new AssetAnalysisException("Unable to determine duration for audio asset " + asset.id() + ".");
            }
            Matcher sampleRate = SAMPLE_RATE_PATTERN.matcher(output);
            if (!sampleRate.find()) {
                throw new AssetAnalysisException("No audio stream found in asset " + asset.id() + ".");
            }
            int hertz = Integer.parseInt(sampleRate.group(1));
            attributes.put("sampleRateHz", hertz);
            qualityScore = Math.min(1.0, (double) hertz / FULL_QUALITY_SAMPLE_RATE);
        } else {
            Matcher resolution = RESOLUTION_PATTERN.matcher(output);
            if (!resolution.find()) {
                throw new AssetAnalysisException("No video stream found in asset " + asset.id() + ".");
            }
            if (asset.mediaType() == AssetMediaType.VIDEO && durationSeconds == null) {
                throw new AssetAnalysisException("Unable to determine duration for video asset " + asset.id() + ".");
            }
            width = Integer.parseInt(resolution.group(1));
            height = Integer.parseInt(resolution.group(2));
            qualityScore = Math.min(1.0, (width * (double) height) / FULL_HD_PIXELS);
        }

        qualityScore = BigDecimal.valueOf(qualityScore).setScale(2, RoundingMode.HALF_UP).doubleValue();
        String summary = summarize(asset, durationSeconds, width, height);
        return new AssetAnalysisResult(
                asset.id(),
                asset.mediaType(),
                asset.mediaType() == AssetMediaType.IMAGE ? null : durationSeconds,
                width,
                height,
                qualityScore,
                summary,
                attributes);
    }

    private String readMediaInfo(InputAsset asset, Duration timeout) throws AssetAnalysisException, InterruptedException {
        Path outputFile = null;
        try {
            outputFile = Files.createTempFile("production-planner-ffmpeg-", ".log");
            List<String> command = List.of(resolveFfmpegBinary(), "-hide_banner", "-i", asset.url());
            logger.debug("Probing asset {} with {}", asset.id(), String.join(" ", command));

            // Output goes to a file so waitFor enforces the timeout even if ffmpeg stalls mid-stream.
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new AnalysisTimeoutException(asset.id(), timeout);
            }
            // ffmpeg exits non-zero when no output file is given; only the printed stream info matters.
            return Files.readString(outputFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AssetAnalysisException("Unable to inspect asset " + asset.id() + ".", e);
        } finally {
            deleteTempFile(outputFile);
        }
    }

    private BigDecimal parseDuration(String output) {
        Matcher matcher = DURATION_PATTERN.matcher(output);
        if (!matcher.find()) {
            return null;
        }
        long hours = Long.parseLong(matcher.group(1));
        long minutes = Long.parseLong(matcher.group(2));
        BigDecimal seconds = new BigDecimal(matcher.group(3));
        return BigDecimal.valueOf(Duration.ofHours(hours).plusMinutes(minutes).toSeconds()).add(seconds);
    }

    private String summarize(InputAsset asset, BigDecimal durationSeconds, Integer width, Integer height) {
        StringBuilder summary = new StringBuilder(asset.mediaType().toApiValue());
        if (width != null && height != null) {
            summary.append(' ').append(width).append('x').append(height);
        }
        if (durationSeconds != null && asset.mediaType() != AssetMediaType.IMAGE) {
            summary.append(", ").append(durationSeconds.toPlainString()).append("s");
        }
        if (asset.description() != null && !asset.description().isBlank()) {
            summary.append(": ").append(asset.description().trim());
        }
        return summary.toString();
    }

    private String resolveFfmpegBinary() {
        String configuredPath = properties.ffmpeg().path();
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        String environmentPath = System.getenv(FFMPEG_PATH_ENV);
        if (environmentPath != null && !environmentPath.isBlank()) {
            return environmentPath;
        }
        return DEFAULT_FFMPEG_BINARY;
    }

    private void deleteTempFile(Path filePath) {
        if (filePath == null) {
            return;
        }
        try {
            Files.deleteIfExists(filePath);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
