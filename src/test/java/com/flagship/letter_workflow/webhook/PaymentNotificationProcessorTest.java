package com.flagship.letter_workflow.webhook;

import com.flagship.letter_workflow.allowance.Allowance;
import com.flagship.letter_workflow.allowance.AllowanceService;
import com.flagship.letter_workflow.allowance.AllowanceStatus;
import com.flagship.letter_workflow.exception.ValidationException;
import com.flagship.letter_workflow.subscription.CommissionRepository;
import com.flagship.letter_workflow.subscription.CommissionService;
import com.flagship.letter_workflow.subscription.CouponUsageRepository;
import com.flagship.letter_workflow.subscription.EmployeeCouponEntity;
import com.flagship.letter_workflow.subscription.EmployeeCouponRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payment notifications against a real PostgreSQL.
 *
 * These tests verify:
 * - A redelivered completion activates the subscription exactly once
 * - Activation is all or nothing, dedup record included
 * - Expired and failed checkouts close pending allowances
 */
@SpringBootTest
@Testcontainers
class PaymentNotificationProcessorTest {

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
    private PaymentNotificationProcessor processor;

    @Autowired
    private IdempotentEventRecorder recorder;

    @Autowired
    private AllowanceService allowanceService;

    @Autowired
    private CommissionService commissionService;

    @Autowired
    private EmployeeCouponRepository couponRepository;

    @Autowired
    private CouponUsageRepository couponUsageRepository;

    @Autowired
    private CommissionRepository commissionRepository;

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

    private String newEventId() {
        return "evt_" + UUID.randomUUID().toString().replace("-", "");
    }

    private String issueCoupon(UUID employeeId) {
        String code = "EMP" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        couponRepository.save(EmployeeCouponEntity.issue(employeeId, code, new BigDecimal("20")));
        return code;
    }

    private String checkoutCompleted(String eventId, UUID userId, String couponCode, UUID employeeId) {
        String coupon = couponCode != null ? ", \"coupon_code\": \"" + couponCode + "\"" : "";
        String employee = employeeId != null ? ", \"employee_id\": \"" + employeeId + "\"" : "";
        return """
            {
              "id": "%s",
              "type": "checkout.session.completed",
              "created": 1714557600,
              "api_version": "2024-04-10",
              "data": {
                "object": {
                  "id": "cs_test_%s",
                  "customer": "cus_test",
                  "payment_status": "paid",
                  "metadata": {
                    "user_id": "%s",
                    "plan_type": "monthly",
                    "letters": "4",
                    "base_price": "299.00",
                    "discount": "59.80",
                    "final_price": "239.20"%s%s
                  }
                }
              }
            }
            """.formatted(eventId, eventId, userId, coupon, employee);
    }

    private int commissionRows(UUID employeeId) {
        return jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM commissions WHERE employee_id = ?", Integer.class, employeeId);
    }

    @Test
    @DisplayName("evt delivered twice: activation, commission and coupon usage happen once")
    void testRedeliveredCompletion_ExactlyOnce() {
        printTestHeader("Redelivered Completion - Exactly Once");

        UUID userId = UUID.randomUUID();
        UUID employeeId = UUID.randomUUID();
        String couponCode = issueCoupon(employeeId);
        String eventId = newEventId();
        String payload = checkoutCompleted(eventId, userId, couponCode, employeeId);

        WebhookAck first = processor.process(payload);
        BigDecimal totalAfterFirst = commissionService.totalForEmployee(employeeId);
        System.out.println("First ack: " + first + ", commission total: " + totalAfterFirst);

        assertTrue(first.isReceived());
        assertFalse(first.isAlreadyProcessed());
        assertEquals(new BigDecimal("11.96"), totalAfterFirst);

        WebhookAck second = processor.process(payload);
        System.out.println("Second ack: " + second);

        assertTrue(second.isReceived());
        assertTrue(second.isAlreadyProcessed());
        assertEquals(totalAfterFirst, commissionService.totalForEmployee(employeeId));
        assertEquals(1, commissionRows(employeeId));
        assertEquals(1, couponUsageRepository.countByCouponCode(couponCode));
        assertEquals(1, couponRepository.findByEmployeeId(employeeId).orElseThrow().getUsageCount());

        Allowance active = allowanceService.findActive(userId).orElseThrow();
        assertEquals(4, active.getCreditsRemaining());
        assertEquals(new BigDecimal("239.20"), active.getFinalPrice());
        assertEquals(1, allowanceService.history(userId).size());

        printSuccess("Side effects applied exactly once");
    }

    @Test
    @DisplayName("Commission failure rolls back the allowance grant and the dedup record")
    void testActivationAtomicity() {
        printTestHeader("Activation Atomicity");

        UUID userId = UUID.randomUUID();
        UUID employeeWithoutCoupon = UUID.randomUUID();
        String eventId = newEventId();

        assertThrows(DataAccessException.class,
                () -> processor.process(checkoutCompleted(eventId, userId, null, employeeWithoutCoupon)));

        assertTrue(allowanceService.findActive(userId).isEmpty(), "No active allowance without its commission");
        assertTrue(allowanceService.history(userId).isEmpty());
        assertEquals(0, commissionRows(employeeWithoutCoupon));
        assertFalse(recorder.isRecorded(eventId), "Failed event must be processable on redelivery");

        printSuccess("Nothing committed");
    }

    @Test
    @DisplayName("Activation without referral creates no commission")
    void testActivationWithoutReferral() {
        printTestHeader("Activation Without Referral");

        UUID userId = UUID.randomUUID();
        processor.process(checkoutCompleted(newEventId(), userId, null, null));

        Allowance active = allowanceService.findActive(userId).orElseThrow();
        assertEquals(4, active.getCreditsRemaining());
        assertTrue(commissionRepository.findByAllowanceId(active.getId()).isEmpty());

        printSuccess("Plain activation");
    }

    @Test
    @DisplayName("Unpaid session is acknowledged without activation")
    void testUnpaidSession() {
        printTestHeader("Unpaid Session");

        UUID userId = UUID.randomUUID();
        String payload = checkoutCompleted(newEventId(), userId, null, null)
                .replace("\"payment_status\": \"paid\"", "\"payment_status\": \"unpaid\"");

        WebhookAck ack = processor.process(payload);

        assertTrue(ack.isReceived());
        assertTrue(allowanceService.findActive(userId).isEmpty());

        printSuccess("No activation for unpaid session");
    }

    @Test
    @DisplayName("Missing metadata is a validation error and the event is not recorded")
    void testMissingMetadata() {
        printTestHeader("Missing Metadata");

        String eventId = newEventId();
        String payload = """
            {"id": "%s", "type": "checkout.session.completed",
             "data": {"object": {"id": "cs_test", "payment_status": "paid"}}}
            """.formatted(eventId);

        assertThrows(ValidationException.class, () -> processor.process(payload));
        assertFalse(recorder.isRecorded(eventId));
        assertThrows(ValidationException.class, () -> processor.process("not json"));

        printSuccess("Malformed notification refused");
    }

    @Test
    @DisplayName("Expired checkout cancels pending allowances, failed payment marks them failed")
    void testCheckoutClosures() {
        printTestHeader("Checkout Closures");

        UUID expiredUser = UUID.randomUUID();
        UUID failedUser = UUID.randomUUID();
        openPendingCheckout(expiredUser);
        openPendingCheckout(failedUser);

        processor.process("""
            {"id": "%s", "type": "checkout.session.expired",
             "data": {"object": {"id": "cs_test", "metadata": {"user_id": "%s"}}}}
            """.formatted(newEventId(), expiredUser));
        processor.process("""
            {"id": "%s", "type": "payment_intent.payment_failed",
             "data": {"object": {"id": "pi_test", "metadata": {"user_id": "%s"}}}}
            """.formatted(newEventId(), failedUser));

        assertEquals(AllowanceStatus.CANCELED, allowanceService.history(expiredUser).get(0).getStatus());
        assertEquals(AllowanceStatus.PAYMENT_FAILED, allowanceService.history(failedUser).get(0).getStatus());

        printSuccess("Pending checkouts closed");
    }

    @Test
    @DisplayName("Unknown event types are recorded and acknowledged")
    void testUnknownEventType() {
        printTestHeader("Unknown Event Type");

        String eventId = newEventId();
        WebhookAck ack = processor.process("""
            {"id": "%s", "type": "invoice.created", "data": {"object": {}}}
            """.formatted(eventId));

        assertTrue(ack.isReceived());
        assertTrue(recorder.isRecorded(eventId));

        printSuccess("Unknown type acknowledged");
    }

    private void openPendingCheckout(UUID userId) {
        jdbcTemplate.update("""
            INSERT INTO allowances (id, user_id, status, plan_type, granted_credits, credits_remaining,
                                    base_price, discount_amount, final_price, created_at, updated_at)
            VALUES (?, ?, 'PENDING', 'monthly', 4, 0, 299.00, 0, 299.00, now(), now())
            """, UUID.randomUUID(), userId);
    }
}
