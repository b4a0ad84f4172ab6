package com.tradestore.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Holding of one symbol within one account.
 *
 * <p>Long and short legs are tracked independently, so an account can be long and short the
 * same symbol at once. A position is open while {@code closedAt} is null; closing never
 * deletes the row.
 */
@Data
@Builder
public class Position {

    private Long positionId;
    private Long accountId;
    private String symbol;
    private Double longQty;
    private Double shortQty;
    private Double longCostBasis;
    private Double shortCostBasis;

    /** Margin reserved against this symbol's short leg. */
    private Double shortMarginUsed;

    private LocalDateTime openedAt;
    private LocalDateTime closedAt;

    public boolean isOpen() {
        return closedAt == null;
    }
}
