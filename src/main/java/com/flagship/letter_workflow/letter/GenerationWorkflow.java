package com.flagship.letter_workflow.letter;

import com.flagship.letter_workflow.allowance.AllowanceService;
import com.flagship.letter_workflow.exception.NoActiveAllowanceException;
import com.flagship.letter_workflow.observability.WorkflowMetrics;
import com.flagship.letter_workflow.retry.TransactionRetrier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Callbacks from the draft generation subsystem.
 *
 * A failed generation gives the owner's credit back. The refund runs in its
 * own transaction after the failure is committed: if the owner's
 * subscription lapsed in between there is no allowance to credit, and the
 * letter stays FAILED with the loss logged for manual reconciliation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationWorkflow {

    private final LetterService letterService;
    private final AllowanceService allowanceService;
    private final TransactionRetrier retrier;
    private final WorkflowMetrics metrics;

    public Letter completeGeneration(UUID letterId, String draftContent) {
        return retrier.execute("completeGeneration",
                () -> letterService.completeGeneration(letterId, draftContent));
    }

    public Letter failGeneration(UUID letterId, String reason) {
        Letter failed = retrier.execute("failGeneration",
                () -> letterService.failGeneration(letterId, reason));

        if (failed.isFreeTrial()) {
            log.info("Letter {} was a free trial letter, nothing to refund", letterId);
            return failed;
        }
        try {
            int remaining = retrier.execute("refundCredit",
                    () -> allowanceService.refund(failed.getOwnerId(), 1, letterId));
            log.info("Refunded generation credit for letter {}: remaining={}", letterId, remaining);
        } catch (NoActiveAllowanceException e) {
            metrics.recordRefund("unreconciled");
            log.error("Could not refund credit for failed letter {}: owner {} has no active allowance",
                    letterId, failed.getOwnerId());
        }
        return failed;
    }
}
