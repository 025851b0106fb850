package com.flagship.letter_workflow.allowance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ManualRefundRequest {

    @Min(value = 1, message = "Refund amount must be at least 1")
    @Max(value = 100, message = "Refund amount must be at most 100")
    @JsonProperty("amount")
    int amount;

    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
