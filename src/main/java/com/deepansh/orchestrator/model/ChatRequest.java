package com.deepansh.orchestrator.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "sessionId must not be blank")
    private String sessionId;

    @NotBlank(message = "userId must not be blank")
    private String userId;

    @NotBlank(message = "prompt must not be blank")
    @Size(max = 8000, message = "prompt must be at most 8000 characters")
    private String prompt;
}
