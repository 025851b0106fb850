package com.flagship.letter_workflow.letter;

import com.flagship.letter_workflow.allowance.AllowanceService;
import com.flagship.letter_workflow.audit.AuditAction;
import com.flagship.letter_workflow.audit.AuditEntry;
import com.flagship.letter_workflow.claim.ClaimService;
import com.flagship.letter_workflow.exception.AlreadyClaimedException;
import com.flagship.letter_workflow.exception.InvalidStateException;
import com.flagship.letter_workflow.exception.NoActiveAllowanceException;
import com.flagship.letter_workflow.exception.NotClaimOwnerException;
import com.flagship.letter_workflow.exception.NotLetterOwnerException;
import com.flagship.letter_workflow.exception.ValidationException;
import com.flagship.letter_workflow.letter.event.LetterStatusChangedEvent;
import com.flagship.letter_workflow.outbox.OutboxEvent;
import com.flagship.letter_workflow.outbox.OutboxService;
import com.flagship.letter_workflow.subscription.ActivationRequest;
import com.flagship.letter_workflow.subscription.SubscriptionActivationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Letter lifecycle against a real PostgreSQL.
 *
 * These tests verify:
 * - Every transition writes its audit entry and owner notification
 * - Submission charges the owner and a refused charge leaves the draft untouched
 * - Failed generation gives the credit back
 * - Review decisions require the reviewer to hold the claim
 */
@SpringBootTest
@Testcontainers
class LetterServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("letter_workflow_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private LetterService letterService;

    @Autowired
    private GenerationWorkflow generationWorkflow;

    @Autowired
    private ClaimService claimService;

    @Autowired
    private AllowanceService allowanceService;

    @Autowired
    private SubscriptionActivationService activationService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void subscribe(UUID userId, int credits) {
        activationService.activate(ActivationRequest.builder()
                .userId(userId)
                .planType("monthly")
                .letters(credits)
                .basePrice(new BigDecimal("299.00"))
                .discountAmount(BigDecimal.ZERO)
                .finalPrice(new BigDecimal("299.00"))
                .build());
    }

    private Letter draftOf(UUID ownerId) {
        return letterService.createDraft(ownerId, "demand_letter", "Security deposit",
                Map.of("landlord", "ACME Rentals", "amount", 1500));
    }

    private UUID underReviewBy(UUID reviewerId) {
        UUID ownerId = UUID.randomUUID();
        Letter draft = draftOf(ownerId);
        letterService.submitForGeneration(draft.getId(), ownerId);
        letterService.completeGeneration(draft.getId(), "Generated draft");
        claimService.claim(draft.getId(), reviewerId);
        return draft.getId();
    }

    @Test
    @DisplayName("Full lifecycle: draft to completed with one audit entry per transition")
    void testFullLifecycle_AuditTrail() {
        printTestHeader("Full Lifecycle - Audit Trail");

        UUID ownerId = UUID.randomUUID();
        UUID reviewerId = UUID.randomUUID();

        Letter draft = draftOf(ownerId);
        assertEquals(LetterStatus.DRAFT, draft.getStatus());
        assertEquals("ACME Rentals", draft.getIntakeData().get("landlord"));

        SubmissionResult submitted = letterService.submitForGeneration(draft.getId(), ownerId);
        assertEquals(LetterStatus.GENERATING, submitted.getLetter().getStatus());
        assertTrue(submitted.getDeduction().isFreeTrial());
        assertTrue(submitted.getLetter().isFreeTrial());

        Letter generated = generationWorkflow.completeGeneration(draft.getId(), "Dear ACME Rentals, ...");
        assertEquals(LetterStatus.PENDING_REVIEW, generated.getStatus());

        claimService.claim(draft.getId(), reviewerId);
        Letter approved = letterService.approve(draft.getId(), reviewerId, "Final text", "Looks good");
        assertEquals(LetterStatus.APPROVED, approved.getStatus());
        assertEquals(reviewerId, approved.getReviewedBy());
        assertNotNull(approved.getApprovedAt());
        assertNull(approved.getClaimedBy(), "Approval clears the claim");

        Letter completed = letterService.markDelivered(draft.getId(), AuditEntry.SYSTEM_ACTOR);
        assertEquals(LetterStatus.COMPLETED, completed.getStatus());

        List<AuditAction> actions = letterService.getAuditTrail(draft.getId()).stream()
                .map(AuditEntry::getAction)
                .toList();
        System.out.println("Audit actions: " + actions);
        assertEquals(List.of(
                AuditAction.CREATED,
                AuditAction.FREE_TRIAL_USED,
                AuditAction.SUBMITTED,
                AuditAction.GENERATED,
                AuditAction.CLAIMED,
                AuditAction.APPROVED,
                AuditAction.COMPLETED), actions);

        List<String> notifications = outboxService.getEventsForAggregate(OutboxService.LETTER_AGGREGATE, draft.getId())
                .stream()
                .map(OutboxEvent::getEventType)
                .toList();
        assertEquals(List.of(
                LetterStatusChangedEvent.LETTER_SUBMITTED,
                LetterStatusChangedEvent.LETTER_READY_FOR_REVIEW,
                LetterStatusChangedEvent.LETTER_APPROVED,
                LetterStatusChangedEvent.LETTER_COMPLETED), notifications);

        printSuccess("Lifecycle audited and notified");
    }

    @Test
    @DisplayName("Submission refused for lack of allowance leaves the draft and counters untouched")
    void testSubmit_RefusedLeavesNoTrace() {
        printTestHeader("Submit - Refused Leaves No Trace");

        UUID ownerId = UUID.randomUUID();
        Letter first = draftOf(ownerId);
        letterService.submitForGeneration(first.getId(), ownerId);

        Letter second = draftOf(ownerId);
        assertThrows(NoActiveAllowanceException.class,
                () -> letterService.submitForGeneration(second.getId(), ownerId));

        assertEquals(LetterStatus.DRAFT, letterService.getLetter(second.getId()).getStatus());
        assertEquals(1, allowanceService.lifetimeUsage(ownerId));
        assertEquals(1, letterService.getAuditTrail(second.getId()).size(), "Only the creation is audited");

        printSuccess("Refused submission rolled back completely");
    }

    @Test
    @DisplayName("Only the owner can submit, and only from draft")
    void testSubmit_OwnerAndStatusChecks() {
        printTestHeader("Submit - Owner And Status Checks");

        UUID ownerId = UUID.randomUUID();
        Letter draft = draftOf(ownerId);

        assertThrows(NotLetterOwnerException.class,
                () -> letterService.submitForGeneration(draft.getId(), UUID.randomUUID()));

        letterService.submitForGeneration(draft.getId(), ownerId);
        assertThrows(InvalidStateException.class,
                () -> letterService.submitForGeneration(draft.getId(), ownerId));

        printSuccess("Non-owner and double submission refused");
    }

    @Test
    @DisplayName("Failed generation refunds the subscription credit")
    void testGenerationFailure_RefundsCredit() {
        printTestHeader("Generation Failure - Refunds Credit");

        UUID ownerId = UUID.randomUUID();
        subscribe(ownerId, 4);
        Letter draft = draftOf(ownerId);

        SubmissionResult submitted = letterService.submitForGeneration(draft.getId(), ownerId);
        assertFalse(submitted.getDeduction().isFreeTrial());
        assertEquals(3, submitted.getDeduction().getRemaining());

        Letter failed = generationWorkflow.failGeneration(draft.getId(), "Model timeout");
        System.out.println("Failed letter: " + failed.getStatus());

        assertEquals(LetterStatus.FAILED, failed.getStatus());
        assertEquals(4, allowanceService.findActive(ownerId).orElseThrow().getCreditsRemaining());

        List<AuditAction> actions = letterService.getAuditTrail(draft.getId()).stream()
                .map(AuditEntry::getAction)
                .toList();
        assertTrue(actions.contains(AuditAction.GENERATION_FAILED));
        assertTrue(actions.contains(AuditAction.CREDIT_REFUNDED));

        printSuccess("Credit returned after failed generation");
    }

    @Test
    @DisplayName("Failed free trial generation has nothing to refund")
    void testGenerationFailure_FreeTrial() {
        printTestHeader("Generation Failure - Free Trial");

        UUID ownerId = UUID.randomUUID();
        Letter draft = draftOf(ownerId);
        letterService.submitForGeneration(draft.getId(), ownerId);

        Letter failed = generationWorkflow.failGeneration(draft.getId(), "Model timeout");

        assertEquals(LetterStatus.FAILED, failed.getStatus());
        assertTrue(allowanceService.findActive(ownerId).isEmpty());
        assertFalse(letterService.getAuditTrail(draft.getId()).stream()
                .anyMatch(entry -> entry.getAction() == AuditAction.CREDIT_REFUNDED));

        printSuccess("No refund attempted for the free trial");
    }

    @Test
    @DisplayName("Failed generation after the subscription lapsed keeps the letter failed")
    void testGenerationFailure_SubscriptionLapsed() {
        printTestHeader("Generation Failure - Subscription Lapsed");

        UUID ownerId = UUID.randomUUID();
        subscribe(ownerId, 2);
        Letter draft = draftOf(ownerId);
        letterService.submitForGeneration(draft.getId(), ownerId);

        jdbcTemplate.update("UPDATE allowances SET status = 'EXPIRED' WHERE user_id = ?", ownerId);

        Letter failed = generationWorkflow.failGeneration(draft.getId(), "Model timeout");

        assertEquals(LetterStatus.FAILED, failed.getStatus());
        assertEquals(LetterStatus.FAILED, letterService.getLetter(draft.getId()).getStatus());

        printSuccess("Unrefundable failure surfaced without undoing the transition");
    }

    @Test
    @DisplayName("Approve requires final content and reject requires a reason")
    void testDecisions_RequireContent() {
        printTestHeader("Decisions - Require Content");

        UUID reviewerId = UUID.randomUUID();
        UUID letterId = underReviewBy(reviewerId);

        assertThrows(ValidationException.class, () -> letterService.approve(letterId, reviewerId, " ", null));
        assertThrows(ValidationException.class, () -> letterService.reject(letterId, reviewerId, "", null));
        assertEquals(LetterStatus.UNDER_REVIEW, letterService.getLetter(letterId).getStatus());

        printSuccess("Empty decisions refused before any transition");
    }

    @Test
    @DisplayName("Decisions require holding the claim")
    void testDecisions_RequireClaim() {
        printTestHeader("Decisions - Require Claim");

        UUID reviewerA = UUID.randomUUID();
        UUID reviewerB = UUID.randomUUID();
        UUID letterId = underReviewBy(reviewerA);

        assertThrows(AlreadyClaimedException.class,
                () -> letterService.approve(letterId, reviewerB, "Final text", null));

        claimService.release(letterId, reviewerA);
        assertThrows(NotClaimOwnerException.class,
                () -> letterService.reject(letterId, reviewerB, "Wrong jurisdiction", null));

        assertEquals(LetterStatus.UNDER_REVIEW, letterService.getLetter(letterId).getStatus());

        printSuccess("Decisions refused without the claim");
    }

    @Test
    @DisplayName("Rejected letters return to draft on resubmit")
    void testRejectAndResubmit() {
        printTestHeader("Reject And Resubmit");

        UUID reviewerId = UUID.randomUUID();
        UUID letterId = underReviewBy(reviewerId);
        UUID ownerId = letterService.getLetter(letterId).getOwnerId();

        Letter rejected = letterService.reject(letterId, reviewerId, "Missing dates", "Ask for the lease");
        assertEquals(LetterStatus.REJECTED, rejected.getStatus());
        assertEquals("Missing dates", rejected.getRejectionReason());
        assertNull(rejected.getClaimedBy());

        assertThrows(NotLetterOwnerException.class, () -> letterService.resubmit(letterId, reviewerId));

        Letter resubmitted = letterService.resubmit(letterId, ownerId);
        assertEquals(LetterStatus.DRAFT, resubmitted.getStatus());
        assertNull(resubmitted.getRejectionReason());

        printSuccess("Rejected letter back in draft");
    }

    @Test
    @DisplayName("Review queue lists reviewable letters with their claim state")
    void testReviewQueue() {
        printTestHeader("Review Queue");

        UUID reviewerId = UUID.randomUUID();
        UUID letterId = underReviewBy(reviewerId);

        ReviewQueueItem item = letterService.listReviewQueue().stream()
                .filter(i -> i.getLetterId().equals(letterId))
                .findFirst()
                .orElseThrow();

        assertEquals(LetterStatus.UNDER_REVIEW, item.getStatus());
        assertEquals(reviewerId, item.getClaimedBy());
        assertFalse(item.isClaimExpired());

        printSuccess("Queue shows live claim");
    }
}
