package tech.yump.keyring.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.keyring.audit.AuditHelper;
import tech.yump.keyring.keys.KeyringException;
import tech.yump.keyring.keys.NoActiveKeyException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to RFC 7807 problem responses and audits every failure.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private final AuditHelper auditHelper;

    @ExceptionHandler(NoActiveKeyException.class)
    public ResponseEntity<ProblemDetail> handleNoActiveKey(NoActiveKeyException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.SERVICE_UNAVAILABLE;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "No active signing key is available yet.");
        problemDetail.setTitle("Key Ring Not Ready");
        log.warn("Request rejected before key ring bootstrap: {} {}", request.getMethod(), request.getRequestURI());

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(KeyringException.class)
    public ResponseEntity<ProblemDetail> handleKeyringException(KeyringException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Keyring Error");
        log.error("Keyring error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        // The parser message may echo request content; keep it out of the response.
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}", request.getDescription(false), ex.getMessage());

        if (request instanceof ServletWebRequest servletWebRequest) {
            auditHelper.logHttpEvent("request_validation", determineAction(servletWebRequest.getRequest()), "failure",
                    status.value(), message, null);
        }
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: validation failed ({}). Request: {}", message, request.getDescription(false));

        if (request instanceof ServletWebRequest servletWebRequest) {
            auditHelper.logHttpEvent("request_validation", determineAction(servletWebRequest.getRequest()), "failure",
                    status.value(), message, null);
        }
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditHelper.logHttpEvent("system_error", determineAction(request), "failure", status.value(), message, null);
        return ResponseEntity.status(status).body(problemDetail);
    }

    private void auditFailure(HttpServletRequest request, HttpStatus status, String errorMessage) {
        auditHelper.logHttpEvent(
                determineEventType(request),
                determineAction(request),
                "failure",
                status.value(),
                errorMessage,
                Map.of("path", request.getRequestURI()));
    }

    private String determineEventType(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.startsWith("/v1/tokens/")) {
            return "token_operation";
        } else if (path.startsWith("/v1/keys/")) {
            return "key_admin";
        } else if (path.startsWith("/.well-known/")) {
            return "jwks";
        }
        return "request_error";
    }

    private String determineAction(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.endsWith("/v1/tokens/sign")) return "sign";
        if (path.endsWith("/v1/tokens/validate")) return "validate";
        if (path.endsWith("/v1/keys/rotate")) return "rotate";
        if (path.endsWith("/v1/keys/health")) return "health";
        if (path.endsWith("/jwks.json")) return "get_jwks";
        return "unknown";
    }
}
