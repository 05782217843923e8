package github.sarthakdev143.production_planner.factory;

import github.sarthakdev143.production_planner.model.manifest.ProductionManifest;
import github.sarthakdev143.production_planner.service.scheduling.JobScheduler;

public interface JobSchedulerFactory {

    JobScheduler create(ProductionManifest manifest);
}
