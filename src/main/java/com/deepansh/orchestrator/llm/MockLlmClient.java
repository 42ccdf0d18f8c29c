package com.deepansh.orchestrator.llm;

/**
 * Deterministic, offline text generator. Selected with {@code llm.provider=mock}
 * (the default) so the whole pipeline runs without an API key.
 *
 * Responses depend only on the prompt: planning prompts get a labelled
 * SUBTASKS / DATA_PLAN reply, composing prompts a labelled ANSWER / SUGGESTIONS
 * reply, summarization prompts a fixed summary.
 */
public class MockLlmClient implements LlmClient {

    private static final String CURRENT_REQUEST_MARKER = "[Current Request]\nUSER: ";

    @Override
    public String generate(String prompt, int maxTokens, double temperature) {
        String lower = prompt.toLowerCase();

        if (prompt.contains("SUBTASKS:")) {
            return """
                    SUBTASKS:
                    1. Retrieve conversation history for this session
                    2. Identify what the user is asking: %s
                    3. Prepare a direct answer using the retrieved context

                    DATA_PLAN:
                    Query the messages collection for this session's history
                    """.formatted(abbreviate(currentRequest(prompt), 60));
        }

        if (prompt.contains("ANSWER:")) {
            return """
                    ANSWER:
                    Here is what I found regarding "%s". I reviewed our conversation so far and the \
                    results of the analysis before answering.

                    SUGGESTIONS:
                    1. Would you like more detail on any part of this?
                    2. Should I summarize our conversation so far?
                    3. Is there a related topic you want to explore?
                    """.formatted(abbreviate(currentRequest(prompt), 80));
        }

        if (lower.contains("summarize") || lower.contains("summary")) {
            return "Here's a summary of the key points discussed: the conversation covered multiple "
                    + "topics with detailed analysis, and earlier questions were answered in turn.";
        }

        return "Mock response to: " + abbreviate(prompt, 50)
                + "... The analysis has been completed with relevant findings.";
    }

    private String currentRequest(String prompt) {
        int idx = prompt.lastIndexOf(CURRENT_REQUEST_MARKER);
        if (idx < 0) {
            return "your request";
        }
        String rest = prompt.substring(idx + CURRENT_REQUEST_MARKER.length());
        int nl = rest.indexOf('\n');
        return (nl >= 0 ? rest.substring(0, nl) : rest).strip();
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
