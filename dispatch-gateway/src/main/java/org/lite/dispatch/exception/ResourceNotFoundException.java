package org.lite.dispatch.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String type, String id) {
        super(String.format("%s '%s' not found", type, id));
    }
}
