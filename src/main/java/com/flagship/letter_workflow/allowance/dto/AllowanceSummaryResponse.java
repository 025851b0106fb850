package com.flagship.letter_workflow.allowance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * What the user can spend right now.
 */
@Value
@Builder
public class AllowanceSummaryResponse {

    @JsonProperty("active")
    AllowanceResponse active;

    @JsonProperty("free_trial_available")
    boolean freeTrialAvailable;

    @JsonProperty("lifetime_letters")
    int lifetimeLetters;
}
