package com.tradestore.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One OHLCV bar inside a {@link PriceBarsRequest}. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceBarRequest {

    @NotNull
    private LocalDateTime openTime;

    @NotNull
    private Double open;

    @NotNull
    private Double high;

    @NotNull
    private Double low;

    @NotNull
    private Double close;

    @NotNull
    private Double volume;

    @NotNull
    private LocalDateTime closeTime;

    private Double quoteVolume;
    private Integer count;
    private Double takerBuyVolume;
    private Double takerBuyQuoteVolume;
}
