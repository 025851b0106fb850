package com.flagship.letter_workflow.letter;

import com.flagship.letter_workflow.claim.ReviewClaim;
import com.flagship.letter_workflow.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA entity for {@code letters}.
 *
 * Key design principles:
 * - No setters: status only changes through the transition methods below,
 *   each checked against {@link LetterTransition}
 * - A claim can only exist while the letter is reviewable, and every
 *   transition out of review clears it (mirrored by a CHECK constraint)
 * - Callers load the row with {@code findByIdForUpdate} before mutating it
 */
@Entity
@Table(name = "letters")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LetterEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "letter_type", nullable = false, length = 64)
    private String letterType;

    @Column(nullable = false)
    private String title;

    @Column(name = "intake_data", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> intakeData;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private LetterStatus status;

    @Column(name = "free_trial", nullable = false)
    private boolean freeTrial;

    @Column(name = "claimed_by")
    private UUID claimedBy;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "draft_content", columnDefinition = "TEXT")
    private String draftContent;

    @Column(name = "final_content", columnDefinition = "TEXT")
    private String finalContent;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "review_notes", columnDefinition = "TEXT")
    private String reviewNotes;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LetterEntity draft(UUID ownerId, String letterType, String title, Map<String, Object> intakeData) {
        return new LetterEntity(UUID.randomUUID(), ownerId, letterType, title, intakeData,
                LetterStatus.DRAFT, false,
                null, null, null, null, null, null, null, null, null,
                null, null);
    }

    public Optional<ReviewClaim> currentClaim() {
        if (claimedBy == null) {
            return Optional.empty();
        }
        return Optional.of(new ReviewClaim(id, claimedBy, claimedAt));
    }

    void markGenerating(boolean fundedByFreeTrial) {
        apply(LetterTransition.SUBMIT);
        this.freeTrial = fundedByFreeTrial;
    }

    void completeGeneration(String draftContent) {
        apply(LetterTransition.GENERATION_SUCCEEDED);
        this.draftContent = draftContent;
    }

    void failGeneration() {
        apply(LetterTransition.GENERATION_FAILED);
    }

    /**
     * Grants the claim to the reviewer, moving a pending letter under review.
     * Conflict detection against a live claim is the caller's job.
     */
    public void claim(UUID reviewerId, Instant now) {
        if (!status.isReviewable()) {
            throw new InvalidStateException(
                "Letter " + id + " is not claimable in " + status + " status");
        }
        if (status == LetterStatus.PENDING_REVIEW) {
            apply(LetterTransition.CLAIM);
        }
        this.claimedBy = reviewerId;
        this.claimedAt = now;
    }

    /**
     * Drops the claim. The status stays where it is.
     */
    public void releaseClaim() {
        this.claimedBy = null;
        this.claimedAt = null;
    }

    void approve(UUID reviewerId, String finalContent, String notes, Instant now) {
        apply(LetterTransition.APPROVE);
        this.finalContent = finalContent;
        this.reviewNotes = notes;
        this.reviewedBy = reviewerId;
        this.reviewedAt = now;
        this.approvedAt = now;
        releaseClaim();
    }

    void reject(UUID reviewerId, String reason, String notes, Instant now) {
        apply(LetterTransition.REJECT);
        this.rejectionReason = reason;
        this.reviewNotes = notes;
        this.reviewedBy = reviewerId;
        this.reviewedAt = now;
        releaseClaim();
    }

    void deliver() {
        apply(LetterTransition.DELIVER);
    }

    void resubmit() {
        apply(LetterTransition.RESUBMIT);
        this.rejectionReason = null;
    }

    private void apply(LetterTransition transition) {
        transition.requireFrom(status);
        this.status = transition.getTo();
    }

    public Letter toDomain() {
        return new Letter(id, ownerId, letterType, title,
                intakeData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(intakeData)) : Map.of(),
                status, freeTrial, claimedBy, claimedAt, draftContent, finalContent,
                reviewedBy, reviewedAt, reviewNotes, rejectionReason, approvedAt,
                createdAt, updatedAt);
    }
}
