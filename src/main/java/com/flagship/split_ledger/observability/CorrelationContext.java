package com.flagship.split_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation ids for HTTP requests and mirror event messages, carried in MDC.
 *
 * Both entry points use the same {@value #CORRELATION_ID_HEADER} header. An incoming id is
 * reused only if it looks like an id; anything else is replaced so that arbitrary header
 * content never reaches the logs.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String GROUP_ID_MDC_KEY = "groupId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    private CorrelationContext() {
    }

    /**
     * Binds a correlation id to the current thread until the returned scope is closed.
     * Closing also clears any group id logged under the scope.
     *
     * @param incoming id received from the caller, may be {@code null}
     */
    public static Scope open(String incoming) {
        String id = incoming != null && ACCEPTED_ID.matcher(incoming).matches()
            ? incoming
            : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return new Scope(id);
    }

    /**
     * Correlation id of the current thread, {@code null} outside any scope.
     */
    public static String current() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static final class Scope implements AutoCloseable {

        private final String correlationId;

        private Scope(String correlationId) {
            this.correlationId = correlationId;
        }

        public String getCorrelationId() {
            return correlationId;
        }

        @Override
        public void close() {
            MDC.remove(CORRELATION_ID_MDC_KEY);
            MDC.remove(GROUP_ID_MDC_KEY);
        }
    }
}
