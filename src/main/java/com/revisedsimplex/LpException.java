package com.revisedsimplex;

/** Base class of every failure raised by the solver. */
public class LpException extends RuntimeException {
    public LpException(String message) { super(message); }
    public LpException(String message, Throwable cause) { super(message, cause); }
}
