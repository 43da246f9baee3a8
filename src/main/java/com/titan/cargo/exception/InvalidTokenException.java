package com.titan.cargo.exception;

public class InvalidTokenException extends ForbiddenException {

    public InvalidTokenException(String message) {
        super(message);
    }
}
