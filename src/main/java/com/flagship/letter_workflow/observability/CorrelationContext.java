package com.flagship.letter_workflow.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id and the MDC keys used across the workflow.
 *
 * The correlation id arrives on the {@code X-Correlation-ID} header (or is
 * generated) and is written to every log line through the MDC, together
 * with the letter and user the current operation works on.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String LETTER_ID_MDC_KEY = "letterId";
    public static final String USER_ID_MDC_KEY = "userId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readable logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts the letter id in the MDC; closing the scope restores whatever
     * letter id was there before.
     */
    public static MdcScope letterScope(UUID letterId) {
        return MdcScope.put(LETTER_ID_MDC_KEY, String.valueOf(letterId));
    }

    public static MdcScope userScope(UUID userId) {
        return MdcScope.put(USER_ID_MDC_KEY, String.valueOf(userId));
    }

    /**
     * MDC entry that puts back the previous value on close, so nested scopes
     * for the same key do not wipe the outer one.
     */
    public static final class MdcScope implements AutoCloseable {

        private final String key;
        private final String previous;

        private MdcScope(String key, String previous) {
            this.key = key;
            this.previous = previous;
        }

        static MdcScope put(String key, String value) {
            String previous = MDC.get(key);
            MDC.put(key, value);
            return new MdcScope(key, previous);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }
}
