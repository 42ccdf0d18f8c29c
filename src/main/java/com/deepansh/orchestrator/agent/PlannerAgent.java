package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.core.Stage;
import com.deepansh.orchestrator.llm.LlmClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Breaks the user's request into 1-3 subtasks plus a data-access plan.
 *
 * The model is asked for a SUBTASKS / DATA_PLAN reply. If it fails, or the
 * reply yields no usable subtask, a keyword-driven plan is used instead,
 * so this stage always produces a plan.
 */
@Component
@Slf4j
public class PlannerAgent extends AbstractStageAgent {

    static final int MAX_SUBTASKS = 3;
    static final String DEFAULT_DATA_PLAN = "Determine data needs based on request context";

    private static final Map<String, String> LABELS = labels();

    private final LlmClient llmClient;
    private final OrchestratorProperties.Generation generation;

    public PlannerAgent(LlmClient llmClient, OrchestratorProperties properties, Clock clock) {
        super(clock);
        this.llmClient = llmClient;
        this.generation = properties.getPlanner();
    }

    @Override
    public Stage stage() {
        return Stage.PLANNER;
    }

    @Override
    protected RequestState run(RequestState state) {
        String prompt = state.getUserPrompt();
        Plan plan;

        try {
            String response = llmClient.generate(buildPrompt(state.getContext()),
                    generation.getMaxTokens(), generation.getTemperature());
            log.debug("[sessionId={}] Planner response chars={}", state.getSessionId(), response.length());
            plan = parse(response);
            if (plan.subtasks().isEmpty()) {
                log.warn("[sessionId={}] Planner reply had no subtasks, using heuristic plan", state.getSessionId());
                plan = heuristicPlan(prompt);
            }
        } catch (Exception e) {
            log.warn("[sessionId={}] Planner generation failed, using heuristic plan: {}",
                    state.getSessionId(), e.getMessage());
            plan = heuristicPlan(prompt);
        }

        String dataPlan = plan.dataPlan().isBlank() ? DEFAULT_DATA_PLAN : plan.dataPlan();
        log.info("[sessionId={}] Planned {} subtasks", state.getSessionId(), plan.subtasks().size());

        return state.toBuilder()
                .subtasks(plan.subtasks())
                .dataAccessPlan(dataPlan)
                .build();
    }

    static Plan parse(String response) {
        Map<String, List<String>> sections = SectionParser.parse(response, LABELS);
        List<String> subtasks = SectionParser.listItems(sections.get("subtasks")).stream()
                .limit(MAX_SUBTASKS)
                .toList();
        String dataPlan = String.join(" ", sections.get("dataPlan")).strip();
        return new Plan(subtasks, dataPlan);
    }

    static Plan heuristicPlan(String prompt) {
        String head = AgentHeuristics.head(prompt, 50);
        if (AgentHeuristics.referencesMemory(prompt)) {
            return new Plan(List.of(
                    "Retrieve conversation history to understand context",
                    "Analyze user's request: " + head,
                    "Formulate contextual response based on history"),
                    "Query messages collection for session history");
        }
        return new Plan(List.of(
                "Understand the request: " + head,
                "Gather relevant information",
                "Prepare comprehensive response"),
                "No database access needed for this request");
    }

    private static String buildPrompt(String context) {
        return """
                You are a planning agent. Analyze the user's request considering conversation history.

                %s

                Your task: Break down the current user request into 1-3 specific, actionable subtasks.
                Also identify if any database queries are needed.

                Format your response exactly like this:

                SUBTASKS:
                1. [First specific subtask]
                2. [Second specific subtask]
                3. [Third specific subtask if needed]

                DATA_PLAN:
                [Describe what data needs to be fetched, or write "No database access needed"]

                Be specific and actionable. Each subtask should be clear.
                """.formatted(context);
    }

    private static Map<String, String> labels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("SUBTASKS:", "subtasks");
        labels.put("DATA_PLAN:", "dataPlan");
        labels.put("DATA PLAN:", "dataPlan");
        return labels;
    }

    record Plan(List<String> subtasks, String dataPlan) {
    }
}
