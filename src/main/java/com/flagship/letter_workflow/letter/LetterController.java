package com.flagship.letter_workflow.letter;

import com.flagship.letter_workflow.letter.dto.AuditEntryResponse;
import com.flagship.letter_workflow.letter.dto.CreateLetterRequest;
import com.flagship.letter_workflow.letter.dto.GenerationCallbackRequest;
import com.flagship.letter_workflow.letter.dto.LetterResponse;
import com.flagship.letter_workflow.letter.dto.SubmissionResponse;
import com.flagship.letter_workflow.observability.WorkflowMetrics;
import com.flagship.letter_workflow.retry.TransactionRetrier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for the letter owner's side of the workflow and the
 * generation subsystem's callback.
 *
 * The caller is identified by the {@code X-User-Id} header, set by the
 * authenticating gateway in front of this service.
 */
@RestController
@RequestMapping("/api/letters")
@RequiredArgsConstructor
@Slf4j
public class LetterController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final LetterService letterService;
    private final GenerationWorkflow generationWorkflow;
    private final TransactionRetrier retrier;
    private final WorkflowMetrics metrics;

    @PostMapping
    public ResponseEntity<LetterResponse> createLetter(
            @Valid @RequestBody CreateLetterRequest request,
            @RequestHeader(USER_ID_HEADER) UUID userId) {

        Letter letter = letterService.createDraft(userId, request.getLetterType(),
                request.getTitle(), request.getIntakeData());
        return ResponseEntity.status(HttpStatus.CREATED).body(LetterResponse.from(letter));
    }

    @GetMapping
    public List<LetterResponse> listMyLetters(@RequestHeader(USER_ID_HEADER) UUID userId) {
        return letterService.listForOwner(userId).stream()
                .map(LetterResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public LetterResponse getLetter(@PathVariable("id") UUID id) {
        return LetterResponse.from(letterService.getLetter(id));
    }

    @GetMapping("/{id}/audit")
    public List<AuditEntryResponse> getAuditTrail(@PathVariable("id") UUID id) {
        return letterService.getAuditTrail(id).stream()
                .map(AuditEntryResponse::from)
                .toList();
    }

    /**
     * Sends a draft to generation, consuming the free trial or one credit.
     * Answers 402 when the owner has nothing left to spend.
     */
    @PostMapping("/{id}/submit")
    public SubmissionResponse submit(
            @PathVariable("id") UUID id,
            @RequestHeader(USER_ID_HEADER) UUID userId) {

        long startTime = System.currentTimeMillis();
        try {
            SubmissionResult result = retrier.execute("submitForGeneration",
                    () -> letterService.submitForGeneration(id, userId));
            return SubmissionResponse.from(result);
        } finally {
            metrics.recordLatency("submit", Duration.ofMillis(System.currentTimeMillis() - startTime));
        }
    }

    @PostMapping("/{id}/generation")
    public LetterResponse generationCallback(
            @PathVariable("id") UUID id,
            @RequestBody GenerationCallbackRequest request) {

        if (request.isFailure()) {
            log.warn("Generation failed for letter {}: {}", id, request.getError());
            return LetterResponse.from(generationWorkflow.failGeneration(id, request.getError()));
        }
        return LetterResponse.from(generationWorkflow.completeGeneration(id, request.getDraftContent()));
    }

    @PostMapping("/{id}/resubmit")
    public LetterResponse resubmit(
            @PathVariable("id") UUID id,
            @RequestHeader(USER_ID_HEADER) UUID userId) {

        return LetterResponse.from(retrier.execute("resubmit", () -> letterService.resubmit(id, userId)));
    }

    @PostMapping("/{id}/deliver")
    public LetterResponse markDelivered(
            @PathVariable("id") UUID id,
            @RequestHeader(USER_ID_HEADER) UUID actorId) {

        return LetterResponse.from(retrier.execute("markDelivered", () -> letterService.markDelivered(id, actorId)));
    }
}
