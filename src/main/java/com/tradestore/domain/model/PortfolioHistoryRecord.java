package com.tradestore.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** A time-stamped valuation snapshot of one account's holdings. Cadence is up to the caller. */
@Data
@Builder
public class PortfolioHistoryRecord {

    private Long recordId;
    private Long accountId;
    private LocalDateTime timestamp;
    private Double portfolioValue;
    private Double longExposure;
    private Double shortExposure;
    private Double grossExposure;
    private Double netExposure;
    private Double longShortRatio;
}
