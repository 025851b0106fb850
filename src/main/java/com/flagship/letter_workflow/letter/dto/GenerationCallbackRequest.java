package com.flagship.letter_workflow.letter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Result reported by the draft generation subsystem.
 *
 * Exactly one of {@code draftContent} (success) or {@code error} (failure)
 * is expected.
 */
@Value
public class GenerationCallbackRequest {

    @JsonProperty("draft_content")
    String draftContent;

    @JsonProperty("error")
    String error;

    public boolean isFailure() {
        return error != null && !error.isBlank();
    }
}
