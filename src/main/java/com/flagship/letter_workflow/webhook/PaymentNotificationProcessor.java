package com.flagship.letter_workflow.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.letter_workflow.allowance.AllowanceService;
import com.flagship.letter_workflow.allowance.AllowanceStatus;
import com.flagship.letter_workflow.exception.ValidationException;
import com.flagship.letter_workflow.observability.WorkflowMetrics;
import com.flagship.letter_workflow.subscription.ActivationRequest;
import com.flagship.letter_workflow.subscription.ActivationResult;
import com.flagship.letter_workflow.subscription.CheckoutService;
import com.flagship.letter_workflow.subscription.SubscriptionActivationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Handles payment provider notifications exactly once.
 *
 * The notification is recorded and its side effects applied in a single
 * transaction. A redelivered notification is acknowledged without touching
 * anything. If handling fails, the dedup record rolls back with everything
 * else and the provider's next delivery is treated as new.
 *
 * Handled types:
 * - {@code checkout.session.completed} (paid): subscription activation
 * - {@code checkout.session.expired}: pending checkouts canceled
 * - {@code payment_intent.payment_failed}: pending checkouts marked failed
 * Anything else is recorded and acknowledged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentNotificationProcessor {

    static final String CHECKOUT_COMPLETED = "checkout.session.completed";
    static final String CHECKOUT_EXPIRED = "checkout.session.expired";
    static final String PAYMENT_FAILED = "payment_intent.payment_failed";

    private final IdempotentEventRecorder recorder;
    private final SubscriptionActivationService activationService;
    private final AllowanceService allowanceService;
    private final ObjectMapper objectMapper;
    private final WorkflowMetrics metrics;

    @Transactional
    public WebhookAck process(String payload) {
        JsonNode event = parse(payload);
        String eventId = requiredText(event, "id");
        String eventType = requiredText(event, "type");

        RecordResult recorded = recorder.recordIfNew(eventId, eventType, recordMetadata(event));
        metrics.recordWebhookEvent(eventType, !recorded.isAlreadyProcessed());
        if (recorded.isAlreadyProcessed()) {
            return WebhookAck.duplicate();
        }

        JsonNode object = event.path("data").path("object");
        switch (eventType) {
            case CHECKOUT_COMPLETED -> handleCheckoutCompleted(eventId, object);
            case CHECKOUT_EXPIRED -> closePending(object, AllowanceStatus.CANCELED);
            case PAYMENT_FAILED -> closePending(object, AllowanceStatus.PAYMENT_FAILED);
            default -> log.info("Unhandled payment event type {} ({})", eventType, eventId);
        }
        return WebhookAck.processed();
    }

    private void handleCheckoutCompleted(String eventId, JsonNode session) {
        if (!"paid".equals(session.path("payment_status").asText())) {
            log.info("Checkout session of event {} not paid yet, skipping", eventId);
            return;
        }
        JsonNode metadata = session.path("metadata");
        if (!metadata.isObject()) {
            throw new ValidationException("Checkout session of event " + eventId + " carries no metadata");
        }

        ActivationRequest request = ActivationRequest.builder()
                .userId(uuid(metadata, CheckoutService.META_USER_ID, true))
                .planType(optionalText(metadata, CheckoutService.META_PLAN_TYPE, "unknown"))
                .letters(metadata.path(CheckoutService.META_LETTERS).asInt(0))
                .basePrice(amount(metadata, CheckoutService.META_BASE_PRICE))
                .discountAmount(amount(metadata, CheckoutService.META_DISCOUNT))
                .finalPrice(amount(metadata, CheckoutService.META_FINAL_PRICE))
                .couponCode(optionalText(metadata, CheckoutService.META_COUPON_CODE, null))
                .employeeId(uuid(metadata, CheckoutService.META_EMPLOYEE_ID, false))
                .externalSessionId(optionalText(session, "id", null))
                .externalCustomerId(optionalText(session, "customer", null))
                .build();

        ActivationResult result = activationService.activate(request);
        log.info("Event {} activated allowance {}", eventId, result.getAllowance().getId());
    }

    private void closePending(JsonNode object, AllowanceStatus outcome) {
        UUID userId = uuid(object.path("metadata"), CheckoutService.META_USER_ID, false);
        if (userId == null) {
            log.info("Payment event without user metadata, nothing to close");
            return;
        }
        allowanceService.closePendingCheckouts(userId, outcome);
    }

    private JsonNode parse(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                throw new ValidationException("Payment notification must be a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed payment notification: " + e.getOriginalMessage());
        }
    }

    private String recordMetadata(JsonNode event) {
        ObjectNode metadata = objectMapper.createObjectNode();
        if (event.hasNonNull("created")) {
            metadata.set("created", event.get("created"));
        }
        if (event.hasNonNull("api_version")) {
            metadata.set("api_version", event.get("api_version"));
        }
        return metadata.isEmpty() ? null : metadata.toString();
    }

    private static String requiredText(JsonNode node, String field) {
        String value = node.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new ValidationException("Payment notification is missing '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field, String fallback) {
        String value = node.path(field).asText(null);
        return value == null || value.isBlank() ? fallback : value;
    }

    private static UUID uuid(JsonNode node, String field, boolean required) {
        String value = optionalText(node, field, null);
        if (value == null) {
            if (required) {
                throw new ValidationException("Payment metadata is missing '" + field + "'");
            }
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Payment metadata '" + field + "' is not a valid id: " + value);
        }
    }

    private static BigDecimal amount(JsonNode node, String field) {
        String value = optionalText(node, field, "0");
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("Payment metadata '" + field + "' is not a valid amount: " + value);
        }
    }
}
