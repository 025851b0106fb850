package com.flagship.letter_workflow.claim;

import com.flagship.letter_workflow.audit.AuditAction;
import com.flagship.letter_workflow.audit.AuditEntry;
import com.flagship.letter_workflow.exception.AlreadyClaimedException;
import com.flagship.letter_workflow.exception.InvalidStateException;
import com.flagship.letter_workflow.exception.NotClaimOwnerException;
import com.flagship.letter_workflow.exception.NotFoundException;
import com.flagship.letter_workflow.letter.Letter;
import com.flagship.letter_workflow.letter.LetterService;
import com.flagship.letter_workflow.letter.LetterStatus;
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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Review claims against a real PostgreSQL.
 *
 * These tests verify:
 * - Concurrent claims on one letter have exactly one winner
 * - A claim older than 30 minutes can be taken over, a younger one cannot
 * - Release is owner-only and leaves the status untouched
 */
@SpringBootTest
@Testcontainers
class ClaimServiceTest {

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
    private ClaimService claimService;

    @Autowired
    private LetterService letterService;

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

    /**
     * A letter of a fresh owner, paid with the free trial and generated.
     */
    private UUID letterPendingReview() {
        UUID ownerId = UUID.randomUUID();
        Letter draft = letterService.createDraft(ownerId, "demand_letter", "Unpaid invoice",
                Map.of("amount", "1200.00"));
        letterService.submitForGeneration(draft.getId(), ownerId);
        letterService.completeGeneration(draft.getId(), "Dear Sir or Madam, ...");
        return draft.getId();
    }

    private void ageClaim(UUID letterId, int minutes) {
        jdbcTemplate.update(
                "UPDATE letters SET claimed_at = now() - make_interval(mins => ?) WHERE id = ?",
                minutes, letterId);
    }

    @Test
    @DisplayName("Claiming a pending letter moves it under review")
    void testClaim_PendingLetter() {
        printTestHeader("Claim - Pending Letter");

        UUID letterId = letterPendingReview();
        UUID reviewer = UUID.randomUUID();

        ReviewClaim claim = claimService.claim(letterId, reviewer);
        Letter letter = letterService.getLetter(letterId);
        System.out.println("Claim: " + claim + ", status: " + letter.getStatus());

        assertEquals(reviewer, claim.getClaimedBy());
        assertEquals(LetterStatus.UNDER_REVIEW, letter.getStatus());
        assertEquals(reviewer, letter.getClaimedBy());
        assertNotNull(letter.getClaimedAt());

        List<AuditEntry> trail = letterService.getAuditTrail(letterId);
        AuditEntry last = trail.get(trail.size() - 1);
        assertEquals(AuditAction.CLAIMED, last.getAction());
        assertEquals("PENDING_REVIEW", last.getOldStatus());
        assertEquals("UNDER_REVIEW", last.getNewStatus());

        printSuccess("Letter under review with audited claim");
    }

    @Test
    @DisplayName("Concurrent claims by distinct reviewers: exactly one wins")
    void testConcurrentClaims_MutualExclusion() throws Exception {
        printTestHeader("Concurrent Claims - Mutual Exclusion");

        UUID letterId = letterPendingReview();
        int reviewers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(reviewers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(reviewers);
        AtomicInteger wins = new AtomicInteger();
        Set<UUID> reportedClaimants = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < reviewers; i++) {
            UUID reviewer = UUID.randomUUID();
            executor.submit(() -> {
                try {
                    start.await();
                    claimService.claim(letterId, reviewer);
                    wins.incrementAndGet();
                } catch (AlreadyClaimedException e) {
                    reportedClaimants.add(e.getClaimedBy());
                } catch (Exception e) {
                    System.out.println("Unexpected: " + e);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        UUID winner = letterService.getLetter(letterId).getClaimedBy();
        System.out.println("Wins: " + wins.get() + ", winner: " + winner + ", reported: " + reportedClaimants);

        assertEquals(1, wins.get());
        assertEquals(Set.of(winner), reportedClaimants, "Losers must be told who holds the claim");

        printSuccess("Exactly one reviewer holds the claim");
    }

    @Test
    @DisplayName("A claim older than 30 minutes is taken over")
    void testExpiredClaim_TakenOver() {
        printTestHeader("Expired Claim - Taken Over");

        UUID letterId = letterPendingReview();
        UUID reviewerA = UUID.randomUUID();
        UUID reviewerB = UUID.randomUUID();

        claimService.claim(letterId, reviewerA);
        ageClaim(letterId, 31);

        ReviewClaim claim = claimService.claim(letterId, reviewerB);
        System.out.println("New claim: " + claim);

        assertEquals(reviewerB, claim.getClaimedBy());
        assertEquals(reviewerB, letterService.getLetter(letterId).getClaimedBy());
        assertEquals(LetterStatus.UNDER_REVIEW, letterService.getLetter(letterId).getStatus());

        printSuccess("Stale claim transferred to reviewer B");
    }

    @Test
    @DisplayName("A claim younger than 30 minutes blocks other reviewers")
    void testLiveClaim_Blocks() {
        printTestHeader("Live Claim - Blocks");

        UUID letterId = letterPendingReview();
        UUID reviewerA = UUID.randomUUID();
        UUID reviewerB = UUID.randomUUID();

        claimService.claim(letterId, reviewerA);
        ageClaim(letterId, 29);

        AlreadyClaimedException e = assertThrows(AlreadyClaimedException.class,
                () -> claimService.claim(letterId, reviewerB));
        System.out.println("Refused: " + e.getMessage());

        assertEquals(reviewerA, e.getClaimedBy());
        assertEquals(reviewerA, letterService.getLetter(letterId).getClaimedBy());

        printSuccess("Live claim kept by reviewer A");
    }

    @Test
    @DisplayName("Claim, conflict, release, reclaim by another reviewer")
    void testReleaseThenReclaim() {
        printTestHeader("Release Then Reclaim");

        UUID letterId = letterPendingReview();
        UUID reviewerA = UUID.randomUUID();
        UUID reviewerB = UUID.randomUUID();

        claimService.claim(letterId, reviewerA);

        AlreadyClaimedException conflict = assertThrows(AlreadyClaimedException.class,
                () -> claimService.claim(letterId, reviewerB));
        assertEquals(reviewerA, conflict.getClaimedBy());

        claimService.release(letterId, reviewerA);
        Letter released = letterService.getLetter(letterId);
        assertNull(released.getClaimedBy());
        assertEquals(LetterStatus.UNDER_REVIEW, released.getStatus(), "Release must not revert the status");

        claimService.claim(letterId, reviewerB);
        Letter reclaimed = letterService.getLetter(letterId);
        System.out.println("Claimed by: " + reclaimed.getClaimedBy() + ", status: " + reclaimed.getStatus());

        assertEquals(reviewerB, reclaimed.getClaimedBy());
        assertEquals(LetterStatus.UNDER_REVIEW, reclaimed.getStatus());

        long releases = letterService.getAuditTrail(letterId).stream()
                .filter(entry -> entry.getAction() == AuditAction.RELEASED)
                .count();
        assertEquals(1, releases);

        printSuccess("Claim moved from A to B through release");
    }

    @Test
    @DisplayName("Only the holder may release; releasing an unclaimed letter is a no-op")
    void testRelease_OwnershipRules() {
        printTestHeader("Release - Ownership Rules");

        UUID letterId = letterPendingReview();
        UUID reviewerA = UUID.randomUUID();
        UUID reviewerB = UUID.randomUUID();

        assertDoesNotThrow(() -> claimService.release(letterId, reviewerA));

        claimService.claim(letterId, reviewerA);
        assertThrows(NotClaimOwnerException.class, () -> claimService.release(letterId, reviewerB));
        assertEquals(reviewerA, letterService.getLetter(letterId).getClaimedBy());

        printSuccess("Release restricted to the claim holder");
    }

    @Test
    @DisplayName("Reclaiming by the holder refreshes the claim")
    void testReclaim_BySameReviewer() {
        printTestHeader("Reclaim - Same Reviewer");

        UUID letterId = letterPendingReview();
        UUID reviewer = UUID.randomUUID();

        claimService.claim(letterId, reviewer);
        ageClaim(letterId, 20);
        ReviewClaim refreshed = claimService.claim(letterId, reviewer);

        assertFalse(claimService.isExpired(refreshed));
        assertEquals(reviewer, claimService.currentClaim(letterId).orElseThrow().getClaimedBy());

        printSuccess("Claim refreshed");
    }

    @Test
    @DisplayName("Letters outside review cannot be claimed")
    void testClaim_NotClaimable() {
        printTestHeader("Claim - Not Claimable");

        UUID ownerId = UUID.randomUUID();
        Letter draft = letterService.createDraft(ownerId, "demand_letter", "Draft only", Map.of());

        assertThrows(InvalidStateException.class, () -> claimService.claim(draft.getId(), UUID.randomUUID()));
        assertThrows(NotFoundException.class, () -> claimService.claim(UUID.randomUUID(), UUID.randomUUID()));
        assertNull(letterService.getLetter(draft.getId()).getClaimedBy());

        printSuccess("Draft and unknown letters refused");
    }
}
