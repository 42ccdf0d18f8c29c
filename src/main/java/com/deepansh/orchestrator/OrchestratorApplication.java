package com.deepansh.orchestrator;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({OrchestratorProperties.class, LlmProperties.class})
public class OrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
