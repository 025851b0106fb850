package com.flagship.letter_workflow.claim.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class RejectLetterRequest {

    @NotBlank(message = "Rejection reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("notes")
    String notes;
}
