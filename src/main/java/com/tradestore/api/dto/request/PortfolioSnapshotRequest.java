package com.tradestore.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** REST API request DTO for recording a portfolio valuation snapshot. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioSnapshotRequest {

    @NotNull
    private Long accountId;

    @NotNull
    private LocalDateTime timestamp;

    @NotNull
    private Double portfolioValue;

    private Double longExposure;
    private Double shortExposure;
    private Double grossExposure;
    private Double netExposure;
    private Double longShortRatio;
}
