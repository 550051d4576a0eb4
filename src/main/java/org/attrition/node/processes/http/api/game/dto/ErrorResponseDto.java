package org.attrition.node.processes.http.api.game.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.attrition.engine.errors.ErrorCode;

import java.time.Instant;
import java.util.Map;

/**
 * Failure envelope shared by all game endpoints.
 *
 * @param success   always {@code false}
 * @param code      stable error code
 * @param message   human-readable message
 * @param details   structured context, omitted when there is none
 * @param status    HTTP status code
 * @param timestamp ISO-8601 instant of the failure
 */
public record ErrorResponseDto(
    boolean success,
    String code,
    String message,
    @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, Object> details,
    int status,
    String timestamp
) {
    public static ErrorResponseDto of(final ErrorCode code, final String message, final Map<String, Object> details) {
        return new ErrorResponseDto(false, code.name(), message, details, code.httpStatus(), Instant.now().toString());
    }
}
