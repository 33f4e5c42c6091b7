package org.rostilos.reviewpilot.pipelineagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication(scanBasePackages = {
        "org.rostilos.reviewpilot.pipelineagent",
        "org.rostilos.reviewpilot.core.service",
        "org.rostilos.reviewpilot.vcsclient",
        "org.rostilos.reviewpilot.analysisengine"
})
@EnableJpaRepositories(basePackages = "org.rostilos.reviewpilot.core.persistence.repository")
@EntityScan(basePackages = "org.rostilos.reviewpilot.core.model")
@EnableAsync
public class ReviewPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewPilotApplication.class, args);
    }
}
