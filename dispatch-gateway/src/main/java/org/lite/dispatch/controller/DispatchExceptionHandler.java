package org.lite.dispatch.controller;

import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.dto.ErrorCode;
import org.lite.dispatch.dto.ErrorResponse;
import org.lite.dispatch.exception.InvalidAlertRuleException;
import org.lite.dispatch.exception.NoEligibleProviderException;
import org.lite.dispatch.exception.ResourceNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class DispatchExceptionHandler {

    @ExceptionHandler(NoEligibleProviderException.class)
    public ResponseEntity<ErrorResponse> handleNoEligibleProvider(NoEligibleProviderException e) {
        log.warn("No eligible provider: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(ErrorResponse.fromError(ErrorCode.NO_ELIGIBLE_PROVIDER.name(), e.getMessage(),
                Map.of("status", HttpStatus.UNPROCESSABLE_ENTITY.value(),
                    "registeredCandidates", e.getRegisteredCandidates())));
    }

    @ExceptionHandler(InvalidAlertRuleException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRule(InvalidAlertRuleException e) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.fromErrorCode(ErrorCode.INVALID_ALERT_RULE, e.getMessage(), HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBinding(WebExchangeBindException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", HttpStatus.BAD_REQUEST.value());
        e.getFieldErrors().forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        return ResponseEntity.badRequest()
            .body(ErrorResponse.fromError(ErrorCode.VALIDATION_ERROR.name(), "Request validation failed", details));
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.fromErrorCode(ErrorCode.VALIDATION_ERROR, e.getMessage(), HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ErrorResponse.fromErrorCode(ErrorCode.NOT_FOUND, e.getMessage(), HttpStatus.NOT_FOUND.value()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(ErrorResponse.fromErrorCode(ErrorCode.CONFLICT, e.getMessage(), HttpStatus.CONFLICT.value()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        return ResponseEntity.status(e.getStatusCode())
            .body(ErrorResponse.fromError("HTTP_" + e.getStatusCode().value(), e.getReason(),
                Map.of("status", e.getStatusCode().value())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError()
            .body(ErrorResponse.fromErrorCode(ErrorCode.INTERNAL_ERROR, "Internal error", HttpStatus.INTERNAL_SERVER_ERROR.value()));
    }
}
