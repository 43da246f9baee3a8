package com.titan.cargo.exception;

/**
 * Raised when an email is already bound to an identity.
 */
public class DuplicateIdentityException extends BadRequestException {

    public DuplicateIdentityException() {
        super("User already exists");
    }
}
