package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.dto.AssetSubmissionRequest;
import github.sarthakdev143.production_planner.dto.QueryConstraintsRequest;
import github.sarthakdev143.production_planner.dto.QuerySubmissionRequest;
import github.sarthakdev143.production_planner.dto.SceneOutlineRequest;
import github.sarthakdev143.production_planner.model.AssetMediaType;
import github.sarthakdev143.production_planner.model.AssetSource;
import github.sarthakdev143.production_planner.model.InputAsset;
import github.sarthakdev143.production_planner.model.QueryRequest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryRequestValidatorTest {

    private final QueryRequestValidator validator = new QueryRequestValidator();

    @Test
    void normalizeAndValidateTrimsValuesAndAppliesDefaults() {
        QuerySubmissionRequest submission = new QuerySubmissionRequest(
                null,
                "  Make a teaser  ",
                new QueryConstraintsRequest(new BigDecimal("30"), " 9:16 ", null, "fr"),
                List.of(
                        new AssetSubmissionRequest(" img_1 ", "IMAGE", "user", " https://cdn.example.com/1.jpg ", "", null),
                        new AssetSubmissionRequest("music_1", "audio", "generated", "https://cdn.example.com/m.mp3", "Upbeat", true)),
                List.of(new SceneOutlineRequest(" Intro ", "Hello there", null, "img_1")));

        QueryRequest request = validator.normalizeAndValidate(submission);

        assertThat(request.userId()).isEqualTo("anonymous");
        assertThat(request.prompt()).isEqualTo("Make a teaser");
        assertThat(request.constraints().aspectRatio()).isEqualTo("9:16");
        assertThat(request.constraints().platform()).isNull();
        assertThat(request.assets()).containsExactly(
                new InputAsset("img_1", AssetMediaType.IMAGE, AssetSource.USER, "https://cdn.example.com/1.jpg", null, false),
                new InputAsset("music_1", AssetMediaType.AUDIO, AssetSource.GENERATED, "https://cdn.example.com/m.mp3", "Upbeat", true));
        assertThat(request.sceneOutline()).hasSize(1);
        assertThat(request.sceneOutline().get(0).title()).isEqualTo("Intro");
        assertThat(request.sceneOutline().get(0).durationWeight()).isEqualTo(1);
    }

    @Test
    void normalizeAndValidateRejectsStockSource() {
        QuerySubmissionRequest submission = submission(List.of(
                new AssetSubmissionRequest("img_1", "image", "user", "https://cdn.example.com/1.jpg", null, false),
                new AssetSubmissionRequest("img_2", "image", "stock", "https://stock.example.com/2.jpg", null, false)));

        assertThatThrownBy(() -> validator.normalizeAndValidate(submission))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("assets[1].source must be one of user, generated.");
    }

    @Test
    void normalizeAndValidateRejectsUnknownMediaType() {
        QuerySubmissionRequest submission = submission(List.of(
                new AssetSubmissionRequest("doc_1", "pdf", "user", "https://cdn.example.com/1.pdf", null, false)));

        assertThatThrownBy(() -> validator.normalizeAndValidate(submission))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("assets[0].type must be one of image, video, audio.");
    }

    @Test
    void normalizeAndValidateRejectsDuplicateAssetIdsAndMissingUrls() {
        assertThatThrownBy(() -> validator.normalizeAndValidate(submission(List.of(
                new AssetSubmissionRequest("img_1", "image", "user", "https://cdn.example.com/1.jpg", null, false),
                new AssetSubmissionRequest("img_1", "image", "user", "https://cdn.example.com/2.jpg", null, false)))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("assets[1].id 'img_1' is declared more than once.");

        assertThatThrownBy(() -> validator.normalizeAndValidate(submission(List.of(
                new AssetSubmissionRequest("img_1", "image", "user", "  ", null, false)))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("assets[0].url is required.");
    }

    @Test
    void normalizeAndValidateRejectsInvalidPromptAndDuration() {
        assertThatThrownBy(() -> validator.normalizeAndValidate(
                new QuerySubmissionRequest("u", "   ", null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("prompt is required.");

        assertThatThrownBy(() -> validator.normalizeAndValidate(new QuerySubmissionRequest(
                "u", "Teaser", new QueryConstraintsRequest(BigDecimal.ZERO, null, null, null), null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("constraints.durationSeconds must be greater than 0.");
    }

    @Test
    void normalizeAndValidateRejectsSceneReferencingUnknownAsset() {
        QuerySubmissionRequest submission = new QuerySubmissionRequest(
                "u",
                "Teaser",
                null,
                List.of(),
                List.of(new SceneOutlineRequest("Intro", null, 2, "img_9")));

        assertThatThrownBy(() -> validator.normalizeAndValidate(submission))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("scenes[0].assetId 'img_9' does not match any submitted asset.");
    }

    private static QuerySubmissionRequest submission(List<AssetSubmissionRequest> assets) {
        return new QuerySubmissionRequest("user-1", "Teaser", null, assets, null);
    }
}
