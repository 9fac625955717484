package com.interviewpilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Interview orchestrator: REST front end on :8080, plus an optional console
 * interview when started with {@code --interview.console.enabled=true}.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn spring-boot:run -pl orchestrator
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
