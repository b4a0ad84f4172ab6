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
public class PortfolioHistoryResponse {

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
