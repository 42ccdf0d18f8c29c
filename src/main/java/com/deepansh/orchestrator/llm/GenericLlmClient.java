package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible completion client; works with Groq, OpenAI, and Gemini.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                        |
 * |--------------------------|-----------------------------------------------|
 * | 401 invalid_api_key      | AgentException (not retried, not CB failure)  |
 * | 400 model_decommissioned | AgentException with guidance message          |
 * | 429 rate limit           | RuntimeException (retried, counts as failure) |
 * | 400 other                | AgentException (not retried, not CB failure)  |
 * | 5xx server error         | RuntimeException (retried, counts as failure) |
 * | network error            | ResourceAccessException (retried)             |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProperties.Provider props;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProperties.Provider props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = props.getName();
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public String generate(String prompt, int maxTokens, double temperature) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", props.getModel());
        requestBody.put("max_tokens", maxTokens);
        requestBody.put("temperature", temperature);
        requestBody.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        log.debug("Sending prompt of {} chars to {} [model={}, maxTokens={}]",
                prompt.length(), providerName, props.getModel(), maxTokens);

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                    throw new RuntimeException(
                            providerName + " server error [" + res.getStatusCode() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        return parseContent(response);
    }

    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            log.error("Model {} is decommissioned by {}; update llm.providers.{}.model",
                    props.getModel(), providerName, providerName);
            throw new AgentException("Model '" + props.getModel() + "' is decommissioned.");
        }

        if (statusCode == 401) {
            throw new AgentException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }

        throw new AgentException(providerName + " client error [" + statusCode + "]: " + body);
    }

    @SuppressWarnings("unchecked")
    private String parseContent(Map<String, Object> response) {
        if (response == null) {
            throw new AgentException(providerName + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new AgentException(providerName + " returned no choices in response");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage: prompt={} completion={}",
                    usage.get("prompt_tokens"), usage.get("completion_tokens"));
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        Object content = message != null ? message.get("content") : null;
        return content != null ? content.toString() : "";
    }
}
