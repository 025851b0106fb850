package com.flagship.letter_workflow.letter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.letter_workflow.letter.SubmissionResult;
import lombok.Builder;
import lombok.Value;

/**
 * Submitted letter plus how it was paid for.
 */
@Value
@Builder
public class SubmissionResponse {

    @JsonProperty("letter")
    LetterResponse letter;

    @JsonProperty("free_trial")
    boolean freeTrial;

    @JsonProperty("credits_remaining")
    Integer creditsRemaining;

    public static SubmissionResponse from(SubmissionResult result) {
        return SubmissionResponse.builder()
            .letter(LetterResponse.from(result.getLetter()))
            .freeTrial(result.getDeduction().isFreeTrial())
            .creditsRemaining(result.getDeduction().getRemaining())
            .build();
    }
}
