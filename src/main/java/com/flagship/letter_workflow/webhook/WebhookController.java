package com.flagship.letter_workflow.webhook;

import com.flagship.letter_workflow.retry.TransactionRetrier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoint the payment provider delivers notifications to.
 *
 * The raw body is handed to {@link PaymentNotificationProcessor}. A 2xx is
 * returned once the notification is handled or found to be a duplicate;
 * a malformed notification answers 400, and any other failure a 5xx so the
 * provider redelivers it.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final PaymentNotificationProcessor processor;
    private final TransactionRetrier retrier;

    @PostMapping("/payments")
    public WebhookAck receivePaymentNotification(@RequestBody String payload) {
        return retrier.execute("paymentNotification", () -> processor.process(payload));
    }
}
