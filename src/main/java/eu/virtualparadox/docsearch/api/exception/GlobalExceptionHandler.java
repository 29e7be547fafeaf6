package eu.virtualparadox.docsearch.api.exception;

import eu.virtualparadox.docsearch.index.UnknownTenantException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.IOException;
import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @Value("${app.error.show-trace:false}")
    private boolean showTrace;

    @ExceptionHandler(UnknownTenantException.class)
    public ResponseEntity<ErrorResponse> handleUnknownTenant(
            UnknownTenantException ex,
            HttpServletRequest request
    ) {
        log.warn("event=unknown_tenant path={} tenant={}", request.getRequestURI(), ex.getTenantId());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), ex, request);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        log.warn("event=bad_request path={} msg={}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, request);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIndexIo(
            IOException ex,
            HttpServletRequest request
    ) {
        log.error("event=index_io_error path={}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Knowledge folder could not be read: " + ex.getMessage(), ex, request);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleException(
            Exception ex,
            HttpServletRequest request
    ) {
        log.error("event=api_error path={}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", ex, request);
    }

    private ResponseEntity<ErrorResponse> build(
            HttpStatus status,
            String message,
            Exception ex,
            HttpServletRequest request
    ) {
        ErrorResponse error = ErrorResponse.builder()
                .error(status.name())
                .message(message)
                .status(status.value())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .trace(showTrace ? originOf(ex) : null)
                .build();

        return ResponseEntity.status(status).body(error);
    }

    /**
     * {@code ExceptionType at class:line} of the throwing frame.
     */
    private static String originOf(final Exception ex) {
        final StackTraceElement[] frames = ex.getStackTrace();
        if (frames == null || frames.length == 0) {
            return ex.getClass().getSimpleName();
        }
        return ex.getClass().getSimpleName() + " at " + frames[0].getClassName() + ":" + frames[0].getLineNumber();
    }
}
