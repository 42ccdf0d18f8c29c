package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.llm.LlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlannerAgentTest {

    @Mock LlmClient llmClient;

    private PlannerAgent planner;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(10_000), ZoneOffset.UTC);
        planner = new PlannerAgent(llmClient, new OrchestratorProperties(), clock);
    }

    @Test
    void apply_labelledReply_extractsSubtasksAndDataPlan() {
        when(llmClient.generate(contains("[Current Request]"), eq(300), eq(0.5))).thenReturn("""
                SUBTASKS:
                1. Retrieve the conversation history
                2) Identify the name the user gave
                - Answer with that name

                DATA_PLAN:
                Query the messages collection
                for this session
                """);

        RequestState out = planner.apply(state("What's my name?"));

        assertThat(out.getSubtasks()).containsExactly(
                "Retrieve the conversation history",
                "Identify the name the user gave",
                "Answer with that name");
        assertThat(out.getDataAccessPlan()).isEqualTo("Query the messages collection for this session");
        assertThat(out.getCurrentAgent()).isEqualTo("planner");
        assertThat(out.getTimings()).containsKey("planner");
    }

    @Test
    void apply_moreThanThreeItems_keepsFirstThree() {
        when(llmClient.generate(anyString(), eq(300), eq(0.5))).thenReturn("""
                SUBTASKS:
                1. First useful step
                2. Second useful step
                3. Third useful step
                4. Fourth useful step
                DATA PLAN: none needed here
                """);

        RequestState out = planner.apply(state("Explain recursion"));

        assertThat(out.getSubtasks()).hasSize(3).last().isEqualTo("Third useful step");
        assertThat(out.getDataAccessPlan()).isEqualTo("none needed here");
    }

    @Test
    void apply_shortItemsAndUnmarkedLines_discarded() {
        when(llmClient.generate(anyString(), eq(300), eq(0.5))).thenReturn("""
                SUBTASKS:
                1. Do it
                Some commentary without a marker
                2. Explain the answer clearly
                """);

        RequestState out = planner.apply(state("Explain recursion"));

        assertThat(out.getSubtasks()).containsExactly("Explain the answer clearly");
        assertThat(out.getDataAccessPlan()).isEqualTo(PlannerAgent.DEFAULT_DATA_PLAN);
    }

    @Test
    void apply_noSubtasksParsed_memoryPrompt_usesHistoryPlan() {
        when(llmClient.generate(anyString(), eq(300), eq(0.5))).thenReturn("I am not following the format.");

        RequestState out = planner.apply(state("What did we discuss earlier?"));

        assertThat(out.getSubtasks()).containsExactly(
                "Retrieve conversation history to understand context",
                "Analyze user's request: What did we discuss earlier?",
                "Formulate contextual response based on history");
        assertThat(out.getDataAccessPlan()).isEqualTo("Query messages collection for session history");
    }

    @Test
    void apply_generationFails_genericPromptUsesGenericPlan() {
        when(llmClient.generate(anyString(), eq(300), eq(0.5))).thenThrow(new RuntimeException("provider down"));
        String prompt = "Explain how photosynthesis works in plants and why leaves are green in summer";

        RequestState out = planner.apply(state(prompt));

        assertThat(out.getSubtasks()).containsExactly(
                "Understand the request: " + prompt.substring(0, 50),
                "Gather relevant information",
                "Prepare comprehensive response");
        assertThat(out.getDataAccessPlan()).isEqualTo("No database access needed for this request");
    }

    @Test
    void heuristicPlan_memoryKeywordMatchesCaseInsensitiveSubstring() {
        assertThat(PlannerAgent.heuristicPlan("Tell me about MYTHS").subtasks().get(0))
                .isEqualTo("Retrieve conversation history to understand context");
    }

    private static RequestState state(String prompt) {
        return RequestState.builder()
                .sessionId("s1")
                .userId("u1")
                .userPrompt(prompt)
                .context("preamble\n\n[Current Request]\nUSER: " + prompt)
                .build();
    }
}
