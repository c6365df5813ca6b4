package com.forensics.muling.exception;

/**
 * Input rejected before analysis starts. The whole run is refused; no partial results are produced.
 */
public class TransactionValidationException extends RuntimeException {

    public TransactionValidationException(String message) {
        super(message);
    }
}
