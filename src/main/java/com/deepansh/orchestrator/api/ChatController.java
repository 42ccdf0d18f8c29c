package com.deepansh.orchestrator.api;

import com.deepansh.orchestrator.model.ChatRequest;
import com.deepansh.orchestrator.service.ChatService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * POST /v1/chat/stream  body {sessionId, userId, prompt}
 *
 * Responds with text/event-stream: agent, tool_call_started,
 * tool_call_completed, token, then done or error.
 */
@RestController
@RequestMapping("/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ChatService chatService;

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody ChatRequest request) {
        log.info("Chat stream request [sessionId={}, userId={}, promptChars={}]",
                request.getSessionId(), request.getUserId(), request.getPrompt().length());
        return chatService.stream(request);
    }
}
