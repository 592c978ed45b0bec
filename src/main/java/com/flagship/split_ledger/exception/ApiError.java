package com.flagship.split_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.observability.CorrelationContext;
import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Error body of every failed API call. {@code correlation_id} matches the
 * {@value CorrelationContext#CORRELATION_ID_HEADER} response header.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    @JsonProperty("status")
    int status;

    @JsonProperty("error")
    String error;

    @JsonProperty("message")
    String message;

    @JsonProperty("details")
    Map<String, String> details;

    @JsonProperty("correlation_id")
    String correlationId;

    @JsonProperty("timestamp")
    Instant timestamp;

    static ApiError of(HttpStatus status, String error, String message, Map<String, String> details) {
        return ApiError.builder()
            .status(status.value())
            .error(error)
            .message(message)
            .details(details)
            .correlationId(CorrelationContext.current())
            .timestamp(Instant.now())
            .build();
    }
}
