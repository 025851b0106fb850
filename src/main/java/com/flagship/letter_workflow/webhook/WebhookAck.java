package com.flagship.letter_workflow.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Acknowledgment returned to the payment provider. Any 2xx stops its retries.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public class WebhookAck {

    @JsonProperty("received")
    boolean received;

    @JsonProperty("already_processed")
    boolean alreadyProcessed;

    public static WebhookAck processed() {
        return new WebhookAck(true, false);
    }

    public static WebhookAck duplicate() {
        return new WebhookAck(true, true);
    }
}
