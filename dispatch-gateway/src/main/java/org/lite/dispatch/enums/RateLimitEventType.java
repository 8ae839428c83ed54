package org.lite.dispatch.enums;

public enum RateLimitEventType {
    ALLOWED,
    DENIED
}
