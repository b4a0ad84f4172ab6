package com.tradestore.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A trading account's balance sheet: cash plus margin state.
 *
 * <p>The id is assigned by the caller, not generated. Balances are mutated on every trade or
 * valuation event; accounts are never deleted.
 */
@Data
@Builder
public class Account {

    private Long accountId;
    private String owner;
    private LocalDateTime createdAt;

    /** Signed; may go negative on a leveraged account. */
    private Double cashBalance;

    private Double marginRequirement;
    private Double marginUsed;

    /** Null until the first balance update. */
    private LocalDateTime lastUpdate;

    /**
     * Whether margin used exceeds the requirement plus available cash. Not enforced by the
     * store; callers decide what to do about it.
     */
    public boolean isMarginOverextended() {
        double used = marginUsed != null ? marginUsed : 0.0;
        double requirement = marginRequirement != null ? marginRequirement : 0.0;
        double cash = cashBalance != null ? cashBalance : 0.0;
        return used > requirement + cash;
    }
}
