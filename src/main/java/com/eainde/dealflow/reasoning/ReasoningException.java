package com.eainde.dealflow.reasoning;

public class ReasoningException extends RuntimeException {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
