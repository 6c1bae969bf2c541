package com.revisedsimplex;

/** Structural input error: dimension mismatch or reference to an undefined variable. */
public class MalformedProblemException extends LpException {
    public MalformedProblemException(String message) { super(message); }
}
