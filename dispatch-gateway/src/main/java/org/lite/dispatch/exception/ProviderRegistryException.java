package org.lite.dispatch.exception;

/**
 * Bad pricing or capability entry in the provider registry configuration.
 */
public class ProviderRegistryException extends RuntimeException {

    public ProviderRegistryException(String message) {
        super(message);
    }
}
