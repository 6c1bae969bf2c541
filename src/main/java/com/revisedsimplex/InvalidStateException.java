package com.revisedsimplex;

/** An operation was invoked on a solve state that is not in the required lifecycle state. */
public class InvalidStateException extends LpException {
    public InvalidStateException(String message) { super(message); }
}
