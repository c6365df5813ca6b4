package com.forensics.muling.exception;

/**
 * A detection worker failed or was interrupted. The run is abandoned.
 */
public class DetectionExecutionException extends RuntimeException {

    public DetectionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
