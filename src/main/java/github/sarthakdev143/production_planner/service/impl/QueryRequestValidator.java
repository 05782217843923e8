package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.dto.AssetSubmissionRequest;
import github.sarthakdev143.production_planner.dto.QueryConstraintsRequest;
import github.sarthakdev143.production_planner.dto.QuerySubmissionRequest;
import github.sarthakdev143.production_planner.dto.SceneOutlineRequest;
import github.sarthakdev143.production_planner.model.AssetMediaType;
import github.sarthakdev143.production_planner.model.AssetSource;
import github.sarthakdev143.production_planner.model.InputAsset;
import github.sarthakdev143.production_planner.model.QueryConstraints;
import github.sarthakdev143.production_planner.model.QueryRequest;
import github.sarthakdev143.production_planner.model.SceneOutline;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns a raw submission into a {@link QueryRequest}, rejecting anything the analysis pipeline
 * cannot act on. Every failure is an {@link IllegalArgumentException} naming the offending field.
 */
@Component
public class QueryRequestValidator {

    private static final int MAX_PROMPT_LENGTH = 4000;
    private static final int MAX_ASSETS = 20;
    private static final int MAX_SCENES = 50;
    private static final BigDecimal MAX_DURATION_SECONDS = BigDecimal.valueOf(36_000);
    private static final String DEFAULT_USER_ID = "anonymous";

    public QueryRequest normalizeAndValidate(QuerySubmissionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required.");
        }

        String prompt = trimToNull(request.prompt());
        if (prompt == null) {
            throw new IllegalArgumentException("prompt is required.");
        }
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            throw new IllegalArgumentException("prompt must be at most " + MAX_PROMPT_LENGTH + " characters.");
        }

        String userId = trimToNull(request.userId());
        QueryConstraints constraints = normalizeConstraints(request.constraints());
        List<InputAsset> assets = normalizeAssets(request.assets());
        List<SceneOutline> scenes = normalizeScenes(request.scenes(), assets);

        return new QueryRequest(
                userId == null ? DEFAULT_USER_ID : userId,
                prompt,
                constraints,
                assets,
                scenes);
    }

    private QueryConstraints normalizeConstraints(QueryConstraintsRequest constraints) {
        if (constraints == null) {
            return new QueryConstraints(null, null, null, null);
        }

        BigDecimal duration = constraints.durationSeconds();
        if (duration != null) {
            if (duration.signum() <= 0) {
                throw new IllegalArgumentException("constraints.durationSeconds must be greater than 0.");
            }
            if (duration.compareTo(MAX_DURATION_SECONDS) > 0) {
                throw new IllegalArgumentException(
                        "constraints.durationSeconds must be less than or equal to " + MAX_DURATION_SECONDS + " seconds.");
            }
        }

        return new QueryConstraints(
                duration,
                trimToNull(constraints.aspectRatio()),
                trimToNull(constraints.platform()),
                trimToNull(constraints.language()));
    }

    private List<InputAsset> normalizeAssets(List<AssetSubmissionRequest> assets) {
        if (assets == null || assets.isEmpty()) {
            return List.of();
        }
        if (assets.size() > MAX_ASSETS) {
            throw new IllegalArgumentException("assets supports at most " + MAX_ASSETS + " entries.");
        }

        List<InputAsset> normalized = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int index = 0; index < assets.size(); index++) {
            AssetSubmissionRequest asset = assets.get(index);
            String field = "assets[" + index + "]";
            if (asset == null) {
                throw new IllegalArgumentException(field + " must not be null.");
            }

            String id = trimToNull(asset.id());
            if (id == null) {
                throw new IllegalArgumentException(field + ".id is required.");
            }
            if (!seenIds.add(id)) {
                throw new IllegalArgumentException(field + ".id '" + id + "' is declared more than once.");
            }

            AssetMediaType mediaType = parseField(field, asset.type(), AssetMediaType::fromInput);
            AssetSource source = parseField(field, asset.source(), AssetSource::fromInput);

            String url = trimToNull(asset.url());
            if (url == null) {
                throw new IllegalArgumentException(field + ".url is required.");
            }

            normalized.add(new InputAsset(
                    id,
                    mediaType,
                    source,
                    url,
                    trimToNull(asset.description()),
                    Boolean.TRUE.equals(asset.optional())));
        }
        return normalized;
    }

    private List<SceneOutline> normalizeScenes(List<SceneOutlineRequest> scenes, List<InputAsset> assets) {
        if (scenes == null || scenes.isEmpty()) {
            return List.of();
        }
        if (scenes.size() > MAX_SCENES) {
            throw new IllegalArgumentException("scenes supports at most " + MAX_SCENES + " scenes.");
        }

        Set<String> assetIds = new HashSet<>();
        assets.forEach(asset -> assetIds.add(asset.id()));

        List<SceneOutline> normalized = new ArrayList<>();
        for (int index = 0; index < scenes.size(); index++) {
            SceneOutlineRequest scene = scenes.get(index);
            String field = "scenes[" + index + "]";
            if (scene == null) {
                throw new IllegalArgumentException(field + " must not be null.");
            }

            int weight = scene.durationWeight() == null ? 1 : scene.durationWeight();
            if (weight < 1) {
                throw new IllegalArgumentException(field + ".durationWeight must be at least 1.");
            }

            String assetId = trimToNull(scene.assetId());
            if (assetId != null && !assetIds.contains(assetId)) {
                throw new IllegalArgumentException(field + ".assetId '" + assetId + "' does not match any submitted asset.");
            }

            normalized.add(new SceneOutline(
                    trimToNull(scene.title()),
                    trimToNull(scene.narration()),
                    weight,
                    assetId));
        }
        return normalized;
    }

    private <T> T parseField(String field, String input, Function<String, T> parser) {
        try {
            return parser.apply(input);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(field + "." + ex.getMessage(), ex);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
