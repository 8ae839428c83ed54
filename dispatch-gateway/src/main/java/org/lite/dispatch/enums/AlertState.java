package org.lite.dispatch.enums;

public enum AlertState {
    FIRING,
    ACKNOWLEDGED,
    RESOLVED;

    public boolean isOpen() {
        return this != RESOLVED;
    }
}
