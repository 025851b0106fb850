package com.flagship.letter_workflow.claim;

import com.flagship.letter_workflow.claim.dto.ApproveLetterRequest;
import com.flagship.letter_workflow.claim.dto.ClaimResponse;
import com.flagship.letter_workflow.claim.dto.RejectLetterRequest;
import com.flagship.letter_workflow.claim.dto.ReviewQueueItemResponse;
import com.flagship.letter_workflow.config.WorkflowProperties;
import com.flagship.letter_workflow.letter.LetterService;
import com.flagship.letter_workflow.letter.dto.LetterResponse;
import com.flagship.letter_workflow.retry.TransactionRetrier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for reviewers: the review queue, claims and decisions.
 *
 * A claim conflict answers 409 with the current claimant in the error
 * details, so the UI can show who is reviewing the letter.
 */
@RestController
@RequestMapping("/api/review")
@RequiredArgsConstructor
@Slf4j
public class ReviewController {

    private static final String REVIEWER_ID_HEADER = "X-User-Id";

    private final ClaimService claimService;
    private final LetterService letterService;
    private final TransactionRetrier retrier;
    private final WorkflowProperties properties;

    @GetMapping("/queue")
    public List<ReviewQueueItemResponse> queue() {
        return letterService.listReviewQueue().stream()
                .map(ReviewQueueItemResponse::from)
                .toList();
    }

    @PostMapping("/letters/{id}/claim")
    public ClaimResponse claim(
            @PathVariable("id") UUID id,
            @RequestHeader(REVIEWER_ID_HEADER) UUID reviewerId) {

        ReviewClaim claim = retrier.execute("claim", () -> claimService.claim(id, reviewerId));
        return ClaimResponse.from(claim, properties.getClaim().getTtl());
    }

    @DeleteMapping("/letters/{id}/claim")
    public ResponseEntity<Void> release(
            @PathVariable("id") UUID id,
            @RequestHeader(REVIEWER_ID_HEADER) UUID reviewerId) {

        retrier.run("release", () -> claimService.release(id, reviewerId));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/letters/{id}/approve")
    public LetterResponse approve(
            @PathVariable("id") UUID id,
            @RequestHeader(REVIEWER_ID_HEADER) UUID reviewerId,
            @Valid @RequestBody ApproveLetterRequest request) {

        return LetterResponse.from(retrier.execute("approve",
                () -> letterService.approve(id, reviewerId, request.getFinalContent(), request.getNotes())));
    }

    @PostMapping("/letters/{id}/reject")
    public LetterResponse reject(
            @PathVariable("id") UUID id,
            @RequestHeader(REVIEWER_ID_HEADER) UUID reviewerId,
            @Valid @RequestBody RejectLetterRequest request) {

        return LetterResponse.from(retrier.execute("reject",
                () -> letterService.reject(id, reviewerId, request.getReason(), request.getNotes())));
    }
}
