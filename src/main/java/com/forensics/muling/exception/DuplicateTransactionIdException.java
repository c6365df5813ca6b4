package com.forensics.muling.exception;

import lombok.Getter;

/**
 * Two input records share the same transaction id.
 */
@Getter
public class DuplicateTransactionIdException extends TransactionValidationException {

    private final String transactionId;

    public DuplicateTransactionIdException(String transactionId) {
        super("Duplicate transaction id: " + transactionId);
        this.transactionId = transactionId;
    }
}
