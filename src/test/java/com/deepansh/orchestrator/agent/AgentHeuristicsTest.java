package com.deepansh.orchestrator.agent;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AgentHeuristicsTest {

    @ParameterizedTest
    @ValueSource(strings = {"Fetch the log", "Look at PAST orders", "read Messages", "conversation recap"})
    void needsDataAccess_keywordAnywhere_true(String subtask) {
        assertThat(AgentHeuristics.needsDataAccess(subtask)).isTrue();
    }

    @Test
    void needsDataAccess_noKeyword_false() {
        assertThat(AgentHeuristics.needsDataAccess("Prepare comprehensive response")).isFalse();
    }

    @Test
    void referencesMemory_substringMatch() {
        assertThat(AgentHeuristics.referencesMemory("What's my name?")).isTrue();
        assertThat(AgentHeuristics.referencesMemory("Explain gravity")).isFalse();
    }

    @Test
    void relevanceOverlap_countsDistinctLeadingWordsFoundInText() {
        int score = AgentHeuristics.relevanceOverlap("  History history of ROME and beyond ",
                "completed: study the history of rome");

        assertThat(score).isEqualTo(3);
    }

    @Test
    void relevanceOverlap_blankPrompt_zero() {
        assertThat(AgentHeuristics.relevanceOverlap("   ", "anything")).isZero();
    }
}
