package com.flagship.letter_workflow.claim.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ApproveLetterRequest {

    @NotBlank(message = "Final content is required")
    @JsonProperty("final_content")
    String finalContent;

    @JsonProperty("notes")
    String notes;
}
