package com.titan.cargo.exception;

public class TokenExpiredException extends ForbiddenException {

    public TokenExpiredException(String message) {
        super(message);
    }
}
