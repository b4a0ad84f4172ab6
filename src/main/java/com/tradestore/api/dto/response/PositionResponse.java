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
public class PositionResponse {

    private Long positionId;
    private Long accountId;
    private String symbol;
    private Double longQty;
    private Double shortQty;
    private Double longCostBasis;
    private Double shortCostBasis;
    private Double shortMarginUsed;
    private LocalDateTime openedAt;
    private LocalDateTime closedAt;
    private boolean open;
}
