package org.lite.dispatch.model;

import lombok.Value;
import org.lite.dispatch.enums.ScopeType;

@Value
public class RateLimitKey {
    ScopeType scope;
    String key;

    public String asString() {
        return scope.name().toLowerCase() + ":" + key;
    }
}
