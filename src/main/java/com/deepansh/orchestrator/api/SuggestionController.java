package com.deepansh.orchestrator.api;

import com.deepansh.orchestrator.exception.ResourceNotFoundException;
import com.deepansh.orchestrator.model.SuggestionResponse;
import com.deepansh.orchestrator.observability.SuggestionRecord;
import com.deepansh.orchestrator.observability.SuggestionRecordRepository;
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
 * GET /v1/suggestions/{messageId}                    suggestions for one answer
 * GET /v1/suggestions/session/{sessionId}?limit=10   newest first
 */
@RestController
@RequestMapping("/v1/suggestions")
@RequiredArgsConstructor
public class SuggestionController {

    private final SuggestionRecordRepository suggestionRepository;

    @GetMapping("/{messageId}")
    public ResponseEntity<SuggestionResponse> getForMessage(@PathVariable String messageId) {
        SuggestionRecord record = suggestionRepository.findFirstByMessageId(messageId)
                .orElseThrow(() -> new ResourceNotFoundException("Suggestions not found for message: " + messageId));
        return ResponseEntity.ok(toResponse(record));
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<SuggestionResponse>> getForSession(
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(suggestionRepository
                .findBySessionIdOrderByCreatedAtDesc(sessionId, PageRequest.of(0, limit)).stream()
                .map(SuggestionController::toResponse)
                .toList());
    }

    private static SuggestionResponse toResponse(SuggestionRecord record) {
        return SuggestionResponse.builder()
                .messageId(record.getMessageId())
                .suggestions(record.getSuggestions())
                .createdAt(record.getCreatedAt())
                .build();
    }
}
