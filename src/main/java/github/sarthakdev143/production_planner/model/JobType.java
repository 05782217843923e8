package github.sarthakdev143.production_planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum JobType {
    SPEECH_SYNTHESIS("speech-synthesis"),
    IMAGE_GENERATION("image-generation"),
    IMAGE_ENHANCEMENT("image-enhancement"),
    VIDEO_GENERATION("video-generation"),
    MUSIC_GENERATION("music-generation"),
    CHART_GENERATION("chart-generation"),
    LIP_SYNC("lip-sync"),
    RENDER("render");

    private final String apiValue;

    JobType(String apiValue) {
        this.apiValue = apiValue;
    }

    public static JobType fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("type is required.");
        }

        String normalized = input.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (JobType type : values()) {
            if (type.apiValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("type must be one of "
                + Arrays.stream(values()).map(JobType::toApiValue).collect(Collectors.joining(", "))
                + ".");
    }

    @JsonValue
    public String toApiValue() {
        return apiValue;
    }
}
