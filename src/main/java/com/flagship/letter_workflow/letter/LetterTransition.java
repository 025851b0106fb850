package com.flagship.letter_workflow.letter;

import com.flagship.letter_workflow.audit.AuditAction;
import com.flagship.letter_workflow.exception.InvalidStateException;

import java.util.Arrays;
import java.util.Optional;

/**
 * The letter transition table. Each transition names its source and target
 * status and the audit action recorded with it.
 */
public enum LetterTransition {
    SUBMIT(LetterStatus.DRAFT, LetterStatus.GENERATING, AuditAction.SUBMITTED),
    GENERATION_SUCCEEDED(LetterStatus.GENERATING, LetterStatus.PENDING_REVIEW, AuditAction.GENERATED),
    GENERATION_FAILED(LetterStatus.GENERATING, LetterStatus.FAILED, AuditAction.GENERATION_FAILED),
    CLAIM(LetterStatus.PENDING_REVIEW, LetterStatus.UNDER_REVIEW, AuditAction.CLAIMED),
    APPROVE(LetterStatus.UNDER_REVIEW, LetterStatus.APPROVED, AuditAction.APPROVED),
    REJECT(LetterStatus.UNDER_REVIEW, LetterStatus.REJECTED, AuditAction.REJECTED),
    DELIVER(LetterStatus.APPROVED, LetterStatus.COMPLETED, AuditAction.COMPLETED),
    RESUBMIT(LetterStatus.REJECTED, LetterStatus.DRAFT, AuditAction.RESUBMITTED);

    private final LetterStatus from;
    private final LetterStatus to;
    private final AuditAction auditAction;

    LetterTransition(LetterStatus from, LetterStatus to, AuditAction auditAction) {
        this.from = from;
        this.to = to;
        this.auditAction = auditAction;
    }

    public LetterStatus getFrom() {
        return from;
    }

    public LetterStatus getTo() {
        return to;
    }

    public AuditAction getAuditAction() {
        return auditAction;
    }

    public static Optional<LetterTransition> between(LetterStatus from, LetterStatus to) {
        return Arrays.stream(values())
                .filter(t -> t.from == from && t.to == to)
                .findFirst();
    }

    /**
     * @throws InvalidStateException if the letter is not in this transition's source status
     */
    public void requireFrom(LetterStatus current) {
        if (current != from) {
            throw new InvalidStateException(String.format(
                    "Transition %s is not allowed for a letter in %s status; it requires %s.",
                    name(), current, from));
        }
    }
}
