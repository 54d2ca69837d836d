package com.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlanOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(PlanOrchestratorApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

}
