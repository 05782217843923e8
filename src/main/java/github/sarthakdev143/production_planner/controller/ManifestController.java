package github.sarthakdev143.production_planner.controller;

import github.sarthakdev143.production_planner.dto.ManifestDocumentRequest;
import github.sarthakdev143.production_planner.dto.ManifestValidationResponse;
import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;
import github.sarthakdev143.production_planner.model.validation.ValidationReport;
import github.sarthakdev143.production_planner.service.impl.ManifestAssembler;
import github.sarthakdev143.production_planner.service.impl.ManifestDocumentMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Checks manifest documents produced elsewhere against the same timeline, reference and
 * dependency rules applied to generated manifests.
 */
@RestController
@RequestMapping("/api/manifests")
public class ManifestController {

    private static final Logger logger = LoggerFactory.getLogger(ManifestController.class);

    private final ManifestDocumentMapper manifestDocumentMapper;
    private final ManifestAssembler manifestAssembler;

    public ManifestController(ManifestDocumentMapper manifestDocumentMapper, ManifestAssembler manifestAssembler) {
        this.manifestDocumentMapper = manifestDocumentMapper;
        this.manifestAssembler = manifestAssembler;
    }

    @PostMapping(value = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> validate(@RequestBody ManifestDocumentRequest document) {
        try {
            ManifestDraft draft = manifestDocumentMapper.toDraft(document);
            ValidationReport report = manifestAssembler.validate(draft);
            logger.info(
                    "Validated manifest document valid={} scenes={} jobs={}",
                    report.valid(),
                    draft.scenes().size(),
                    draft.jobs().size());
            return ResponseEntity.ok(ManifestValidationResponse.from(report));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Manifest validation failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to validate manifest. Please try again.");
        }
    }
}
