package com.tradestore.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** REST API request DTO for applying a fill to an open position. Null fields are left unchanged. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionUpdateRequest {

    private Double longQty;
    private Double shortQty;
    private Double longCostBasis;
    private Double shortCostBasis;
    private Double shortMarginUsed;
}
