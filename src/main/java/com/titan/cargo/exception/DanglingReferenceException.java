package com.titan.cargo.exception;

public class DanglingReferenceException extends BadRequestException {

    public DanglingReferenceException(String referenceType, String referenceId) {
        super("Referenced " + referenceType + " not found: " + referenceId);
    }
}
