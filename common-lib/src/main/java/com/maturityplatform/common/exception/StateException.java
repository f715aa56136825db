package com.maturityplatform.common.exception;

/** Operation is illegal in the current lifecycle state of the entity. */
public class StateException extends MaturityException {

    public StateException(String message) {
        super(message);
    }
}
