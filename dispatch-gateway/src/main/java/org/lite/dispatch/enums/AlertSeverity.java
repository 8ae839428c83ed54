package org.lite.dispatch.enums;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
