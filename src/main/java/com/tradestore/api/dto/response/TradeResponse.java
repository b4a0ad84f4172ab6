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
public class TradeResponse {

    private Long tradeId;
    private Long accountId;
    private String symbol;
    private LocalDateTime timestamp;
    private String side;
    private Double quantity;
    private Double price;
    private Double fee;
    private Double realizedPl;
    private String strategyName;
}
