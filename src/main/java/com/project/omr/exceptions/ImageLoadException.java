package com.project.omr.exceptions;

public class ImageLoadException extends OmrException {
    public ImageLoadException(String message) { super(message); }
    public ImageLoadException(String message, Throwable cause) { super(message, cause); }
}
