package com.deepansh.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for the pipeline and its HTTP surface.
 * Bound from application.yml under the "orchestrator" prefix.
 */
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private Context context = new Context();
    private Generation planner = new Generation(300, 0.5);
    private Generation composer = new Generation(500, 0.7);
    private Executor executor = new Executor();
    private Stream stream = new Stream();
    private Tools tools = new Tools();
    private Api api = new Api();

    @Data
    public static class Context {
        /** K: number of most recent turns included verbatim */
        private int recentTurns = 10;
        /** Re-summarization threshold on the estimated context size */
        private int tokenBudget = 3000;
        private int summaryTargetTokens = 500;
        /** heuristic | llm */
        private String summarizer = "heuristic";
    }

    @Data
    public static class Generation {
        private int maxTokens;
        private double temperature;

        public Generation() {
        }

        public Generation(int maxTokens, double temperature) {
            this.maxTokens = maxTokens;
            this.temperature = temperature;
        }
    }

    @Data
    public static class Executor {
        private String historyCollection = "messages";
        private int queryLimit = 50;
    }

    @Data
    public static class Stream {
        /** Pause between token events; 0 disables pacing */
        private long tokenDelayMs = 50;
        /** SseEmitter timeout; 0 means no timeout */
        private long timeoutMs = 0;
        /** Concurrent pipeline runs kept warm */
        private int workers = 4;
        private int maxWorkers = 16;
        /** Requests waiting for a worker before new ones are rejected */
        private int queueCapacity = 100;
    }

    @Data
    public static class Tools {
        /** Comma-separated collections db.find / db.aggregate may read; empty allows all */
        private String readableCollections = "messages,sessions,metrics,suggestions,tool_calls";
        /** Comma-separated collections db.insert may write; empty allows none */
        private String writableCollections = "messages,metrics,suggestions,tool_calls";

        public List<String> getReadableCollectionList() {
            return split(readableCollections);
        }

        public List<String> getWritableCollectionList() {
            return split(writableCollections);
        }
    }

    @Data
    public static class Api {
        private String token = "devkey";
        /** Comma-separated allowlist; "*" allows all */
        private String corsOrigins = "*";

        public List<String> getCorsOriginList() {
            return split(corsOrigins);
        }
    }

    private static List<String> split(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();
    }
}
