package com.flagship.letter_workflow.allowance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.letter_workflow.allowance.DeductionResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeductionResponse {

    @JsonProperty("free_trial")
    boolean freeTrial;

    @JsonProperty("credits_remaining")
    Integer creditsRemaining;

    public static DeductionResponse from(DeductionResult result) {
        return DeductionResponse.builder()
            .freeTrial(result.isFreeTrial())
            .creditsRemaining(result.getRemaining())
            .build();
    }
}
