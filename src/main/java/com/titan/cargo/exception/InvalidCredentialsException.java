package com.titan.cargo.exception;

/**
 * Same message for an unknown email and a wrong password.
 */
public class InvalidCredentialsException extends BadRequestException {

    public InvalidCredentialsException() {
        super("Invalid credentials");
    }
}
