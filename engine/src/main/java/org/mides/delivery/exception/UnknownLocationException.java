package org.mides.delivery.exception;

import lombok.Getter;

@Getter
public class UnknownLocationException extends RuntimeException {

    private final String location;

    public UnknownLocationException(String location) {
        super(String.format("Unknown location: %s", location));
        this.location = location;
    }
}
