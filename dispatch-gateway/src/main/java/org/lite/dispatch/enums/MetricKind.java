package org.lite.dispatch.enums;

public enum MetricKind {
    REQUEST,
    CACHE,
    RATE_LIMIT
}
