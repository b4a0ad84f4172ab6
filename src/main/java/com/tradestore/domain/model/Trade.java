package com.tradestore.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * One executed fill. Immutable once written: trades are append-only.
 *
 * <p>{@code side} is free text. "buy" and "sell" (any case) drive cash settlement;
 * other values only pay the fee.
 */
@Data
@Builder
public class Trade {

    public static final String SIDE_BUY = "buy";
    public static final String SIDE_SELL = "sell";

    private Long tradeId;
    private Long accountId;
    private String symbol;
    private LocalDateTime timestamp;
    private String side;
    private Double quantity;
    private Double price;
    private Double fee;

    /** Realized P&L booked by this fill. Zero for opening fills. */
    private Double realizedPl;

    private String strategyName;

    /** Signed cash movement for the account: negative for buys, positive for sells, fee always deducted. */
    public double settlementAmount() {
        double notional = (quantity != null ? quantity : 0.0) * (price != null ? price : 0.0);
        double charged = fee != null ? fee : 0.0;
        if (SIDE_BUY.equalsIgnoreCase(side)) {
            return -notional - charged;
        }
        if (SIDE_SELL.equalsIgnoreCase(side)) {
            return notional - charged;
        }
        return -charged;
    }
}
