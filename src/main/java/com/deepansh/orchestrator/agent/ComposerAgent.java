package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.core.Stage;
import com.deepansh.orchestrator.llm.LlmClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Produces the final answer and exactly three follow-up suggestions, then
 * stamps completedAt.
 *
 * Fallback order when the reply has no ANSWER section:
 * <ol>
 *   <li>the raw reply, if longer than 20 characters and not starting with the label</li>
 *   <li>a synthesized answer naming the prompt and the first finding</li>
 * </ol>
 * If generation itself fails, both answer and suggestions are fixed text.
 */
@Component
@Slf4j
public class ComposerAgent extends AbstractStageAgent {

    static final int SUGGESTION_COUNT = 3;

    static final List<String> FILLER_SUGGESTIONS = List.of(
            "Can you tell me more about this?",
            "What else would you like to know?",
            "Should we explore this topic further?");

    static final List<String> FAILURE_SUGGESTIONS = List.of(
            "Tell me more about what you need",
            "Can you clarify your question?",
            "What would you like to know next?");

    private static final int RAW_ANSWER_MIN_LENGTH = 20;
    private static final Map<String, String> LABELS = labels();

    private final LlmClient llmClient;
    private final OrchestratorProperties.Generation generation;

    public ComposerAgent(LlmClient llmClient, OrchestratorProperties properties, Clock clock) {
        super(clock);
        this.llmClient = llmClient;
        this.generation = properties.getComposer();
    }

    @Override
    public Stage stage() {
        return Stage.COMPOSER;
    }

    @Override
    protected RequestState run(RequestState state) {
        String answer;
        List<String> suggestions;

        try {
            String response = llmClient.generate(buildPrompt(state),
                    generation.getMaxTokens(), generation.getTemperature());
            if (response == null) {
                response = "";
            }
            log.debug("[sessionId={}] Composer response chars={}", state.getSessionId(), response.length());

            Map<String, List<String>> sections = SectionParser.parse(response, LABELS);
            answer = String.join(" ", sections.get("answer")).strip();
            if (answer.isEmpty()) {
                log.warn("[sessionId={}] Composer reply had no answer section, using fallback", state.getSessionId());
                answer = fallbackAnswer(state, response);
            }
            suggestions = padSuggestions(SectionParser.listItems(sections.get("suggestions")));
        } catch (Exception e) {
            log.warn("[sessionId={}] Composer generation failed, using fixed answer: {}",
                    state.getSessionId(), e.getMessage());
            answer = failureAnswer(state);
            suggestions = FAILURE_SUGGESTIONS;
        }

        return state.toBuilder()
                .finalAnswer(answer)
                .suggestions(List.copyOf(suggestions))
                .completedAt(clock.millis())
                .build();
    }

    static String fallbackAnswer(RequestState state, String response) {
        String raw = response.strip();
        if (raw.length() > RAW_ANSWER_MIN_LENGTH && !raw.toUpperCase(Locale.ROOT).startsWith("ANSWER:")) {
            return raw;
        }
        String answer = "I understand you're asking about: " + state.getUserPrompt() + ". ";
        if (!state.getFindings().isEmpty()) {
            return answer + "Based on my analysis: " + state.getFindings().get(0).result();
        }
        return answer + "Let me help you with that.";
    }

    static String failureAnswer(RequestState state) {
        StringBuilder sb = new StringBuilder("I received your message: '")
                .append(state.getUserPrompt()).append("'. ");
        if (!state.getFindings().isEmpty()) {
            sb.append("Analysis shows: ").append(state.getFindings().get(0).result()).append(". ");
        }
        return sb.append("How can I help you further?").toString();
    }

    static List<String> padSuggestions(List<String> parsed) {
        List<String> out = new ArrayList<>(parsed.subList(0, Math.min(parsed.size(), SUGGESTION_COUNT)));
        while (out.size() < SUGGESTION_COUNT) {
            out.add(FILLER_SUGGESTIONS.get(out.size()));
        }
        return out;
    }

    private static String buildPrompt(RequestState state) {
        String findingsText = state.getFindings().isEmpty()
                ? "No specific findings"
                : state.getFindings().stream()
                        .map(f -> "- " + f.result())
                        .collect(Collectors.joining("\n"));

        return """
                You are a helpful AI assistant. Generate a natural, conversational response.

                CONVERSATION CONTEXT:
                %s

                ANALYSIS RESULTS:
                %s

                QUALITY CHECK: %s

                Task: Provide a helpful, natural response to the user's request. If the conversation \
                history contains relevant information (like the user's name, preferences, or previous \
                topics), reference it appropriately.

                Generate your response in this format:

                ANSWER:
                [Your natural, conversational response here]

                SUGGESTIONS:
                1. [Relevant follow-up question or action]
                2. [Another relevant suggestion]
                3. [Third suggestion]
                """.formatted(state.getContext(), findingsText, state.getValidationFeedback());
    }

    private static Map<String, String> labels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("ANSWER:", "answer");
        labels.put("SUGGESTIONS:", "suggestions");
        return labels;
    }
}
