package org.lite.dispatch.enums;

public enum OutcomeStatus {
    SUCCESS,
    FAILURE,
    TIMEOUT;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
