package github.sarthakdev143.production_planner.factory.impl;

import github.sarthakdev143.production_planner.factory.JobSchedulerFactory;
import github.sarthakdev143.production_planner.model.manifest.ProductionManifest;
import github.sarthakdev143.production_planner.service.scheduling.JobGraphBuilder;
import github.sarthakdev143.production_planner.service.scheduling.JobScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class DefaultJobSchedulerFactory implements JobSchedulerFactory {

    private final JobGraphBuilder jobGraphBuilder;
    private final MeterRegistry meterRegistry;

    public DefaultJobSchedulerFactory(JobGraphBuilder jobGraphBuilder, MeterRegistry meterRegistry) {
        this.jobGraphBuilder = jobGraphBuilder;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public JobScheduler create(ProductionManifest manifest) {
        return new JobScheduler(manifest.queryId(), jobGraphBuilder.build(manifest.jobs()), meterRegistry);
    }
}
