package com.flagship.letter_workflow.claim;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A reviewer's time-bounded lease on a letter.
 *
 * Liveness is computed lazily at every acquisition attempt: the lease is
 * expired once strictly more than the TTL has passed since it was taken.
 */
@Value
public class ReviewClaim {
    UUID letterId;
    UUID claimedBy;
    Instant claimedAt;

    public boolean isHeldBy(UUID reviewerId) {
        return claimedBy.equals(reviewerId);
    }

    public boolean isExpiredAt(Instant now, Duration ttl) {
        return Duration.between(claimedAt, now).compareTo(ttl) > 0;
    }

    public Instant expiresAt(Duration ttl) {
        return claimedAt.plus(ttl);
    }
}
