package com.deepansh.orchestrator.agent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword rules shared by the agents. Plain case-insensitive substring
 * matching; "my" matches inside "mystery" and that is intended.
 */
public final class AgentHeuristics {

    public static final List<String> MEMORY_KEYWORDS = List.of(
            "my", "our", "previous", "earlier", "last", "before",
            "conversation", "discussed", "mentioned", "said");

    public static final List<String> DATA_ACCESS_KEYWORDS = List.of(
            "query", "fetch", "retrieve", "history", "data",
            "conversation", "previous", "earlier", "past", "messages");

    static final int RELEVANCE_WORDS = 5;

    private AgentHeuristics() {
    }

    /** True when the prompt refers back to earlier conversation. */
    public static boolean referencesMemory(String prompt) {
        return containsAny(prompt, MEMORY_KEYWORDS);
    }

    /** True when a subtask needs to read persisted messages. */
    public static boolean needsDataAccess(String subtask) {
        return containsAny(subtask, DATA_ACCESS_KEYWORDS);
    }

    /**
     * Number of distinct words among the first five of the prompt that
     * occur as substrings of the findings text. Both sides are case-folded.
     */
    public static int relevanceOverlap(String prompt, String findingsText) {
        String text = findingsText.toLowerCase(Locale.ROOT);
        Set<String> keywords = new LinkedHashSet<>(firstWords(prompt, RELEVANCE_WORDS));
        int score = 0;
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                score++;
            }
        }
        return score;
    }

    static List<String> firstWords(String text, int n) {
        String stripped = text.strip().toLowerCase(Locale.ROOT);
        if (stripped.isEmpty()) {
            return List.of();
        }
        return List.of(stripped.split("\\s+")).stream().limit(n).toList();
    }

    static String head(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }
}
