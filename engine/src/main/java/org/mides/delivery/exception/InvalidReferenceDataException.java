package org.mides.delivery.exception;

public class InvalidReferenceDataException extends RuntimeException {

    public InvalidReferenceDataException(String message) {
        super(message);
    }

    public InvalidReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
