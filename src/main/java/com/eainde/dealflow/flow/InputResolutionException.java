package com.eainde.dealflow.flow;

/**
 * The data a run needs before its first stage could not be found. The message
 * is shown to the user as the run's failure reason.
 */
public class InputResolutionException extends RuntimeException {

    public InputResolutionException(String message) {
        super(message);
    }
}
