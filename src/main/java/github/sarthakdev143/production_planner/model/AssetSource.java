package github.sarthakdev143.production_planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AssetSource {
    USER,
    GENERATED;

    public static AssetSource fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("source is required.");
        }

        try {
            return AssetSource.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("source must be one of user, generated.");
        }
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
