package com.tradestore.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceDatumResponse {

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
    private Integer count;
    private Double takerBuyVolume;
    private Double takerBuyQuoteVolume;
}
