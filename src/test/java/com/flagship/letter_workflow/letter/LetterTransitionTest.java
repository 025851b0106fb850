package com.flagship.letter_workflow.letter;

import com.flagship.letter_workflow.exception.InvalidStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LetterTransitionTest {

    @Test
    @DisplayName("Transition table allows only the listed moves")
    void testTransitionGraph() {
        assertEquals(Optional.of(LetterTransition.SUBMIT),
                LetterTransition.between(LetterStatus.DRAFT, LetterStatus.GENERATING));
        assertEquals(Optional.of(LetterTransition.RESUBMIT),
                LetterTransition.between(LetterStatus.REJECTED, LetterStatus.DRAFT));
        assertEquals(Optional.of(LetterTransition.DELIVER),
                LetterTransition.between(LetterStatus.APPROVED, LetterStatus.COMPLETED));

        assertTrue(LetterTransition.between(LetterStatus.PENDING_REVIEW, LetterStatus.APPROVED).isEmpty(),
                "Approval requires going through review");
        assertTrue(LetterTransition.between(LetterStatus.FAILED, LetterStatus.DRAFT).isEmpty());
        assertTrue(LetterTransition.between(LetterStatus.COMPLETED, LetterStatus.DRAFT).isEmpty());
    }

    @Test
    @DisplayName("requireFrom rejects a letter in the wrong status")
    void testRequireFrom() {
        assertDoesNotThrow(() -> LetterTransition.APPROVE.requireFrom(LetterStatus.UNDER_REVIEW));

        InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> LetterTransition.APPROVE.requireFrom(LetterStatus.PENDING_REVIEW));
        assertTrue(e.getMessage().contains("APPROVE"));
        assertTrue(e.getMessage().contains("PENDING_REVIEW"));
    }

    @Test
    @DisplayName("Only pending and under-review letters are reviewable")
    void testReviewableStatuses() {
        assertTrue(LetterStatus.PENDING_REVIEW.isReviewable());
        assertTrue(LetterStatus.UNDER_REVIEW.isReviewable());
        assertFalse(LetterStatus.DRAFT.isReviewable());
        assertFalse(LetterStatus.APPROVED.isReviewable());
        assertFalse(LetterStatus.GENERATING.isReviewable());
    }
}
