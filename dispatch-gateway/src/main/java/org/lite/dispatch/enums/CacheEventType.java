package org.lite.dispatch.enums;

public enum CacheEventType {
    HIT,
    MISS,
    STORE
}
