package org.lite.dispatch.dto;

public enum ErrorCode {
    VALIDATION_ERROR,
    NOT_FOUND,
    CONFLICT,
    NO_ELIGIBLE_PROVIDER,
    INVALID_ALERT_RULE,
    RATE_LIMITED,
    INTERNAL_ERROR
}
