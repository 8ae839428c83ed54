package org.lite.dispatch.enums;

public enum ScopeType {
    USER,       // per user / tenant
    PROVIDER,   // per backend provider
    IP,         // per client address
    GLOBAL;     // whole gateway

    public String configName() {
        return this == GLOBAL ? "global" : "per_" + name().toLowerCase();
    }
}
