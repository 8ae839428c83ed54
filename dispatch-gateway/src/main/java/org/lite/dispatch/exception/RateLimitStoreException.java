package org.lite.dispatch.exception;

public class RateLimitStoreException extends RuntimeException {

    public RateLimitStoreException(int bucketCount, Throwable cause) {
        super(String.format("Failed to persist %d rate limit buckets", bucketCount), cause);
    }
}
