package eu.virtualparadox.docsearch.api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * JSON body of every failed API call.
 *
 * @param error     HTTP status name, e.g. {@code NOT_FOUND}
 * @param message   human-readable cause
 * @param status    HTTP status code
 * @param path      request URI
 * @param timestamp when the failure was rendered
 * @param trace     origin of the exception, only when {@code app.error.show-trace} is on
 */
@Builder
public record ErrorResponse(String error,
                            String message,
                            int status,
                            String path,
                            Instant timestamp,
                            @JsonInclude(JsonInclude.Include.NON_NULL) String trace) {
}
