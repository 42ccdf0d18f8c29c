package com.deepansh.orchestrator.memory;

/**
 * One persisted user or assistant message as seen by the context packer.
 *
 * @param role      "user" or "assistant"
 * @param content   message text
 * @param timestamp epoch milliseconds the message was stored
 */
public record ConversationTurn(String role, String content, long timestamp) {

    public String formatLine() {
        String r = role != null ? role.toUpperCase() : "UNKNOWN";
        return r + ": " + (content != null ? content : "");
    }

    public boolean isUser() {
        return "user".equalsIgnoreCase(role);
    }

    public boolean isAssistant() {
        return "assistant".equalsIgnoreCase(role);
    }
}
