package com.tradestore.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * One OHLCV bar for a symbol/interval pair.
 *
 * <p>(symbol, interval, openTime) is the natural key but is not unique: re-fetched bars are
 * stored again.
 */
@Data
@Builder
public class PriceDatum {

    private Long id;
    private String symbol;
    private String interval;
    private LocalDateTime openTime;
    private Double open;
    private Double high;
    private Double low;
    private Double close;
    private Double volume;
    private LocalDateTime closeTime;
    private Double quoteVolume;

    /** Number of exchange trades in the bar. */
    private Integer count;

    private Double takerBuyVolume;
    private Double takerBuyQuoteVolume;
}
