package com.maturityplatform.common.exception;

/** A referenced benchmark, template or entity does not exist. */
public class NotFoundException extends MaturityException {

    public NotFoundException(String message) {
        super(message);
    }
}
