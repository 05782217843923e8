package github.sarthakdev143.production_planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AssetMediaType {
    IMAGE,
    VIDEO,
    AUDIO;

    public static AssetMediaType fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("type is required.");
        }

        try {
            return AssetMediaType.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("type must be one of image, video, audio.");
        }
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
