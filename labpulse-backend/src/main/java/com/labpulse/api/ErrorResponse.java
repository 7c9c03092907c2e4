package com.labpulse.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.labpulse.web.TraceIdFilter;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

/**
 * Error body returned by every endpoint. {@code trace_id} matches the {@code X-Request-Id} response header.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String code;
    private String message;
    private String details;
    private String traceId;

    /**
     * Build an error tagged with the current request's trace id.
     */
    public static ErrorResponse of(String code, String message, String details) {
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
    }
}
