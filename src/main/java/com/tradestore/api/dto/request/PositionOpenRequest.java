package com.tradestore.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** REST API request DTO for opening a position. openedAt defaults to now. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionOpenRequest {

    @NotNull
    private Long accountId;

    @NotBlank
    private String symbol;

    private LocalDateTime openedAt;
    private Double longQty;
    private Double shortQty;
    private Double longCostBasis;
    private Double shortCostBasis;
    private Double shortMarginUsed;
}
