package com.deepansh.orchestrator.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bound from {@code llm.*}.
 *
 * <pre>
 * llm:
 *   provider: groq            # or openai, gemini, mock
 *   http: { connect-timeout-ms, response-timeout-ms, max-connections }
 *   providers:
 *     groq: { api-key, base-url, model }
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    public static final String MOCK = "mock";

    private String provider = MOCK;
    private Http http = new Http();
    private Map<String, Provider> providers = new LinkedHashMap<>();

    /** The configured entry for {@link #provider}, or null for mock and unknown names. */
    public Provider activeProvider() {
        Provider p = providers.get(provider.toLowerCase());
        if (p != null && p.getName() == null) {
            p.setName(provider.toLowerCase());
        }
        return p;
    }

    @Data
    public static class Http {
        private long connectTimeoutMs = 5000;
        private long responseTimeoutMs = 60000;
        private int maxConnections = 20;
    }

    /** One OpenAI-compatible endpoint. */
    @Data
    public static class Provider {
        private String name;
        private String apiKey;
        private String baseUrl;
        private String model;

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        /** First 8 and last 4 characters, for startup logs. */
        public String maskedKey() {
            if (!hasApiKey()) return "<unset>";
            if (apiKey.length() <= 12) return apiKey.substring(0, Math.min(4, apiKey.length())) + "...";
            return apiKey.substring(0, 8) + "..." + apiKey.substring(apiKey.length() - 4);
        }
    }
}
