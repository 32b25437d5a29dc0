package com.eainde.dealflow.run;

public class UnknownRunException extends RuntimeException {

    public UnknownRunException(String runId) {
        super("Unknown run: " + runId);
    }
}
