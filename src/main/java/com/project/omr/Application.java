package com.project.omr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Bootstraps the Spring context that wires the detection engine. Holds no
 * business logic; callers obtain {@code OmrDetector} or
 * {@code BatchEvaluationService} from the context.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
