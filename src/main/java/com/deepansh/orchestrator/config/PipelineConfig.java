package com.deepansh.orchestrator.config;

import com.deepansh.orchestrator.agent.ComposerAgent;
import com.deepansh.orchestrator.agent.ExecutorAgent;
import com.deepansh.orchestrator.agent.PlannerAgent;
import com.deepansh.orchestrator.agent.ValidatorAgent;
import com.deepansh.orchestrator.core.PipelineController;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    @Bean
    public PipelineController pipelineController(PlannerAgent planner,
                                                 ExecutorAgent executor,
                                                 ValidatorAgent validator,
                                                 ComposerAgent composer) {
        return new PipelineController(planner, executor, validator, composer);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
