package com.forensics.muling.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.SortedSet;

/**
 * Everything one run says about a single account. Feeds account-level narratives and drill-down views.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AccountContext {

    AccountScore accountScore;
    List<Cycle> rings;
    /** Null when the account raised no smurfing alert. */
    SmurfingAlert smurfingAlert;
    /** Profile computed on demand, without the bulk pre-filter. */
    ShellProfile shellProfile;
    /** Accounts the money reaches within a few outgoing hops, excluding the account itself. */
    SortedSet<String> neighbourhood;
}
