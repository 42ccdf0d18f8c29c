package com.deepansh.orchestrator.api;

import com.deepansh.orchestrator.memory.MessageRecord;
import com.deepansh.orchestrator.memory.MessageRecordRepository;
import com.deepansh.orchestrator.memory.SessionService;
import com.deepansh.orchestrator.model.SessionResponse;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /v1/sessions?userId=u1                       a user's sessions, most recent first
 * GET /v1/sessions/{sessionId}                    session info, 404 if unknown
 * GET /v1/sessions/{sessionId}/messages?limit=50  messages, oldest first
 */
@RestController
@RequestMapping("/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;
    private final MessageRecordRepository messageRepository;

    @GetMapping
    public ResponseEntity<List<SessionResponse>> listSessions(@RequestParam String userId) {
        return ResponseEntity.ok(sessionService.userSessions(userId));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.describe(sessionId));
    }

    @GetMapping("/{sessionId}/messages")
    public ResponseEntity<List<MessageRecord>> getMessages(
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(messageRepository.findBySessionIdOrderByTimestampAsc(
                sessionId, PageRequest.of(0, limit)));
    }
}
