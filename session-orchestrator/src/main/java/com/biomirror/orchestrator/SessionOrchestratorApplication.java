package com.biomirror.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SessionOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionOrchestratorApplication.class, args);
    }
}
