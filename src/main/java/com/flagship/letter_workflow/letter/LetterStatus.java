package com.flagship.letter_workflow.letter;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a letter. Allowed moves between statuses are listed in
 * {@link LetterTransition}.
 */
public enum LetterStatus {
    DRAFT,
    GENERATING,
    PENDING_REVIEW,
    UNDER_REVIEW,
    APPROVED,
    REJECTED,
    COMPLETED,
    FAILED;

    /**
     * Statuses in which a reviewer may hold a claim.
     */
    public static final Set<LetterStatus> REVIEWABLE = EnumSet.of(PENDING_REVIEW, UNDER_REVIEW);

    public boolean isReviewable() {
        return REVIEWABLE.contains(this);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(LetterStatus target) {
        return LetterTransition.between(this, target).isPresent();
    }
}
