package com.flagship.letter_workflow.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEventEntity, UUID> {

    Optional<WebhookEventEntity> findByExternalEventId(String externalEventId);

    boolean existsByExternalEventId(String externalEventId);

    /**
     * Deletes dedup records past the retention window.
     *
     * @return number of deleted records
     */
    @Modifying
    @Query("DELETE FROM WebhookEventEntity e WHERE e.processedAt < :before")
    int deleteProcessedBefore(@Param("before") Instant before);
}
