package com.flagship.letter_workflow.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Records externally delivered events exactly once.
 *
 * The unique constraint on {@code external_event_id} is the dedup signal.
 * The insert uses {@code ON CONFLICT DO NOTHING}, so a duplicate is reported
 * by the affected row count instead of an exception and the surrounding
 * transaction stays usable. Two concurrent deliveries of the same id
 * serialize on the unique index: the second insert waits for the first
 * transaction and then reports no row inserted (or inserts, if the first
 * rolled back).
 *
 * Usage, inside the transaction that applies the event's side effects:
 * <pre>
 * RecordResult result = recorder.recordIfNew(eventId, type, metadataJson);
 * if (result.isAlreadyProcessed()) {
 *     return; // acknowledge without side effects
 * }
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventRecorder {

    private static final String INSERT_SQL = """
        INSERT INTO webhook_events (id, external_event_id, event_type, processed_at, metadata, created_at)
        VALUES (?, ?, ?, ?, CAST(? AS jsonb), ?)
        ON CONFLICT (external_event_id) DO NOTHING
        """;

    private final JdbcTemplate jdbcTemplate;
    private final WebhookEventRepository repository;
    private final Clock clock;

    /**
     * @param metadata JSON document stored with the record, may be null
     * @return fresh on the first sighting of the id, duplicate with the
     *         existing record afterwards
     */
    @Transactional
    public RecordResult recordIfNew(String externalEventId, String eventType, String metadata) {
        if (externalEventId == null || externalEventId.isBlank()) {
            throw new IllegalArgumentException("External event id is required");
        }
        UUID id = UUID.randomUUID();
        Instant now = clock.instant();
        Timestamp timestamp = Timestamp.from(now);

        int inserted = jdbcTemplate.update(INSERT_SQL,
                id, externalEventId, eventType, timestamp, metadata, timestamp);

        if (inserted == 1) {
            log.debug("Recorded new event {} of type {}", externalEventId, eventType);
            return RecordResult.fresh(new WebhookEvent(id, externalEventId, eventType, now, metadata, now));
        }

        WebhookEvent existing = repository.findByExternalEventId(externalEventId)
                .map(WebhookEventEntity::toDomain)
                .orElseThrow(() -> new IllegalStateException(
                        "Event " + externalEventId + " conflicted on insert but could not be read back"));
        log.info("Event {} already processed at {}", externalEventId, existing.getProcessedAt());
        return RecordResult.duplicate(existing);
    }

    @Transactional(readOnly = true)
    public boolean isRecorded(String externalEventId) {
        return repository.existsByExternalEventId(externalEventId);
    }

    /**
     * @return number of purged records
     */
    @Transactional
    public int purgeRecordedBefore(Instant cutoff) {
        int purged = repository.deleteProcessedBefore(cutoff);
        log.debug("Purged {} webhook event(s) processed before {}", purged, cutoff);
        return purged;
    }
}
