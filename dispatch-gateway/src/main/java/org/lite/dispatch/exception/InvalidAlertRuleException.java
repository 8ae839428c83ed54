package org.lite.dispatch.exception;

public class InvalidAlertRuleException extends RuntimeException {

    public InvalidAlertRuleException(String ruleName, String reason) {
        super(String.format("Alert rule '%s' is invalid: %s", ruleName, reason));
    }
}
