package com.flagship.letter_workflow.letter;

import com.flagship.letter_workflow.allowance.DeductionResult;
import lombok.Value;

@Value
public class SubmissionResult {
    Letter letter;
    DeductionResult deduction;
}
