package com.tradestore.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the price_data table.
 * One OHLCV bar per row. There is deliberately no unique key on (symbol, interval, open_time).
 */
@Entity
@Table(name = "price_data")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceDataEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String symbol;

    @Column(name = "interval", nullable = false)
    private String interval;

    @Column(name = "open_time", nullable = false)
    private LocalDateTime openTime;

    @Column(nullable = false)
    private Double open;

    @Column(nullable = false)
    private Double high;

    @Column(nullable = false)
    private Double low;

    @Column(nullable = false)
    private Double close;

    @Column(nullable = false)
    private Double volume;

    @Column(name = "close_time", nullable = false)
    private LocalDateTime closeTime;

    @Column(name = "quote_volume")
    private Double quoteVolume;

    private Integer count;

    @Column(name = "taker_buy_volume")
    private Double takerBuyVolume;

    @Column(name = "taker_buy_quote_volume")
    private Double takerBuyQuoteVolume;
}
