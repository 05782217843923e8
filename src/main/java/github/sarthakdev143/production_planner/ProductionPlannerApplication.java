package github.sarthakdev143.production_planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProductionPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ProductionPlannerApplication.class, args);
	}

}
