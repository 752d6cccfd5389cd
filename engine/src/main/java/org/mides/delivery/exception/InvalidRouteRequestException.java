package org.mides.delivery.exception;

public class InvalidRouteRequestException extends RuntimeException {

    public InvalidRouteRequestException(String message) {
        super(message);
    }
}
