package com.beacon.statusservice.infrastructure.web;

import com.beacon.observability.CorrelationContextHolder;
import com.beacon.statusservice.domain.DeadlineExceededException;
import com.beacon.statusservice.domain.StatusNotFoundException;
import com.beacon.statusservice.domain.StatusValidationException;
import com.beacon.statusservice.domain.StoreUnavailableException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps status-service exceptions to RFC 7807 {@link ProblemDetail} responses:
 *
 * <pre>
 * {
 *   "type": "https://beacon.dev/errors/not-found",
 *   "title": "Not Found",
 *   "status": 404,
 *   "detail": "Service \"unknownservice\" not found",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://beacon.dev/errors/";

    @ExceptionHandler(StatusValidationException.class)
    public ProblemDetail handleValidation(StatusValidationException ex) {
        log.warn("Rejected status request: {}", ex.getMessage());
        ProblemDetail problem =
                problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return problem(
                HttpStatus.BAD_REQUEST,
                "Bad Request",
                "bad-request",
                "Request body must be a JSON object");
    }

    @ExceptionHandler(StatusNotFoundException.class)
    public ProblemDetail handleNotFound(StatusNotFoundException ex) {
        log.info("Status lookup miss: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ProblemDetail handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Status store unavailable: {}", ex.getMessage());
        return problem(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Service Unavailable",
                "store-unavailable",
                "Status store is unavailable");
    }

    @ExceptionHandler(DeadlineExceededException.class)
    public ProblemDetail handleDeadline(DeadlineExceededException ex) {
        log.warn("Deadline exceeded: {}", ex.getMessage());
        return problem(
                HttpStatus.GATEWAY_TIMEOUT, "Gateway Timeout", "deadline-exceeded", ex.getMessage());
    }

    /** Routing errors raised by Spring MVC keep their own status. */
    @ExceptionHandler({
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class,
        NoResourceFoundException.class
    })
    public ProblemDetail handleRouting(Exception ex) {
        log.debug("Request not routed: {}", ex.getMessage());
        ProblemDetail body = ((ErrorResponse) ex).getBody();
        HttpStatus status = HttpStatus.valueOf(body.getStatus());
        return problem(status, status.getReasonPhrase(), "routing", body.getDetail());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(
            HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
