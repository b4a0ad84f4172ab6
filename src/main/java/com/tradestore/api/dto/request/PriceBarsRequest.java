package com.tradestore.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API request DTO for appending a series of bars for one symbol/interval pair.
 * The symbol may be given as "BTC/USDT"; it is stored as "BTCUSDT".
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceBarsRequest {

    @NotBlank
    private String symbol;

    @NotBlank
    private String interval;

    @NotNull
    @Valid
    private List<@NotNull @Valid PriceBarRequest> bars;
}
