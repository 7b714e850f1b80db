package com.project.omr.exceptions;

/** Domain-specific exception for sheet processing errors. */
public class OmrException extends RuntimeException {
    public OmrException(String message) { super(message); }
    public OmrException(String message, Throwable cause) { super(message, cause); }
}
