package com.forensics.muling.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;

/**
 * A single transfer between two accounts, as handed over by the upload layer.
 * Immutable once created; the engine never mutates or re-keys transactions.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Transaction {

    /** Canonical processing order: by timestamp, then by id. */
    public static final Comparator<Transaction> CHRONOLOGICAL =
            Comparator.comparing(Transaction::getTimestamp).thenComparing(Transaction::getId);

    /** Unique within one analysis run. */
    String id;
    String fromAccount;
    String toAccount;
    /** Strictly positive. */
    BigDecimal amount;
    Instant timestamp;
    /** Free text from the source system, optional. */
    String description;

    @JsonIgnore
    public boolean isSelfLoop() {
        return fromAccount != null && fromAccount.equals(toAccount);
    }
}
