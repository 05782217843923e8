package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.model.manifest.AssetPlan;
import github.sarthakdev143.production_planner.model.manifest.ManifestDraft;
import github.sarthakdev143.production_planner.model.manifest.ProductionManifest;
import github.sarthakdev143.production_planner.model.manifest.QualityGate;
import github.sarthakdev143.production_planner.model.validation.DanglingReference;
import github.sarthakdev143.production_planner.model.validation.TimelineValidationResult;
import github.sarthakdev143.production_planner.model.validation.ValidationReport;
import github.sarthakdev143.production_planner.service.scheduling.JobGraphBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Validates a manifest draft and, only when every check passes, freezes it into a
 * {@link ProductionManifest}. Timeline, reference and dependency checks all run so that one
 * report carries every problem. A draft that fails is passed through {@link ManifestRepairer}
 * once and validated again before it is rejected.
 */
@Component
public class ManifestAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ManifestAssembler.class);

    private final TimelineValidator timelineValidator;
    private final ReferenceResolver referenceResolver;
    private final JobGraphBuilder jobGraphBuilder;
    private final ManifestRepairer manifestRepairer;
    private final Counter assembledCounter;
    private final Counter repairedCounter;
    private final Counter rejectedCounter;

    public ManifestAssembler(
            TimelineValidator timelineValidator,
            ReferenceResolver referenceResolver,
            JobGraphBuilder jobGraphBuilder,
            ManifestRepairer manifestRepairer,
            MeterRegistry meterRegistry) {
        this.timelineValidator = timelineValidator;
        this.referenceResolver = referenceResolver;
        this.jobGraphBuilder = jobGraphBuilder;
        this.manifestRepairer = manifestRepairer;
        this.assembledCounter = meterRegistry.counter("production_planner.manifests.assembled");
        this.repairedCounter = meterRegistry.counter("production_planner.manifests.repaired");
        this.rejectedCounter = meterRegistry.counter("production_planner.manifests.rejected");
    }

    public ValidationReport validate(ManifestDraft draft) {
        BigDecimal declaredDuration = draft.metadata() == null ? null : draft.metadata().durationSeconds();
        TimelineValidationResult timeline = timelineValidator.validate(draft.scenes(), declaredDuration);
        Set<DanglingReference> dangling = referenceResolver.resolve(draft);
        List<String> cycle = jobGraphBuilder.findCycle(draft.jobs()).orElse(List.of());
        return new ValidationReport(timeline.violations(), dangling, cycle);
    }

    public AssemblyResult assemble(String queryId, ManifestDraft candidate) {
        ManifestDraft draft = candidate;
        ValidationReport report = validate(draft);
        if (!report.valid()) {
            ManifestRepairer.RepairResult repair = manifestRepairer.repair(draft);
            if (repair.repaired()) {
                repairedCounter.increment();
                logger.info("Repaired manifest for query {} repairs={}", queryId, repair.repairs());
                draft = repair.draft();
                report = validate(draft);
            }
        }
        if (!report.valid()) {
            rejectedCounter.increment();
            logger.warn(
                    "Rejected manifest for query {} timelineViolations={} danglingReferences={} cycle={}",
                    queryId,
                    report.timelineViolations().size(),
                    report.danglingReferences().size(),
                    report.cycle());
            return AssemblyResult.rejected(report);
        }

        boolean requiredAssetsReady = draft.assets().values().stream()
                .filter(AssetPlan::required)
                .allMatch(AssetPlan::ready);
        ProductionManifest manifest = new ProductionManifest(
                queryId,
                draft.userId(),
                draft.sourceRefs(),
                draft.metadata(),
                draft.scenes(),
                draft.assets(),
                draft.audio(),
                draft.jobs(),
                new QualityGate(true, requiredAssetsReady),
                draft.warnings());

        assembledCounter.increment();
        logger.info(
                "Assembled manifest for query {} scenes={} assets={} jobs={} requiredAssetsReady={} warnings={}",
                queryId,
                manifest.scenes().size(),
                manifest.assets().size(),
                manifest.jobs().size(),
                requiredAssetsReady,
                manifest.warnings().size());
        return AssemblyResult.assembled(manifest, report);
    }

    public record AssemblyResult(ProductionManifest manifest, ValidationReport report) {

        static AssemblyResult assembled(ProductionManifest manifest, ValidationReport report) {
            return new AssemblyResult(manifest, report);
        }

        static AssemblyResult rejected(ValidationReport report) {
            return new AssemblyResult(null, report);
        }

        public boolean succeeded() {
            return manifest != null;
        }
    }
}
