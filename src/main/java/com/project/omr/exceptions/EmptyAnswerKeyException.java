package com.project.omr.exceptions;

public class EmptyAnswerKeyException extends OmrException {
    public EmptyAnswerKeyException() {
        super("Answer key is empty: nothing to score against.");
    }
}
