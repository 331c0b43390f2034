package com.example.chunker.interfaces.api.error;

import com.example.chunker.application.exception.ApplicationException;
import com.example.chunker.application.exception.UseCaseValidationException;
import com.example.chunker.domain.exception.DomainException;
import com.example.chunker.domain.exception.StatementNotFoundException;
import com.example.chunker.domain.exception.UnsupportedStatementFormatException;
import com.example.chunker.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain, application and infrastructure failures to HTTP error responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(StatementNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(StatementNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "STATEMENT_NOT_FOUND", null);
    }

    @ExceptionHandler(UnsupportedStatementFormatException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedFormat(UnsupportedStatementFormatException ex,
                                                                 HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_FORMAT",
                Map.of("extension", ex.getExtension()));
    }

    /**
     * Other domain validation failures, such as a missing upload or invalid window settings.
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR", null);
    }

    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR", null);
    }

    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR", null);
    }

    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", null);
    }

	/**
	 * Creates a consistent {@link ErrorResponse} envelope.
	 *
	 * @param error     exception that triggered the handler
	 * @param request   incoming HTTP request
	 * @param status    HTTP status code to return
	 * @param errorCode application-specific error code
	 * @param details   optional extra attributes
	 * @return response entity containing the serialized error
	 */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode,
                                                       Map<String, Object> details) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI(), details);
        return ResponseEntity.status(status).body(response);
    }
}
