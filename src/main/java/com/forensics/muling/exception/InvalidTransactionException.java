package com.forensics.muling.exception;

import com.forensics.muling.domain.Transaction;
import lombok.Getter;

/**
 * A transaction has a missing or out-of-range field (blank account, non-positive amount, no timestamp).
 */
@Getter
public class InvalidTransactionException extends TransactionValidationException {

    private final transient Transaction transaction;
    private final String field;

    public InvalidTransactionException(Transaction transaction, String field, String reason) {
        super("Invalid transaction " + (transaction.getId() != null ? transaction.getId() : "<no id>")
                + ": field '" + field + "' " + reason);
        this.transaction = transaction;
        this.field = field;
    }
}
