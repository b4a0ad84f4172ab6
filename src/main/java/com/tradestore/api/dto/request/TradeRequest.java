package com.tradestore.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** REST API request DTO for appending an executed trade. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeRequest {

    @NotNull
    private Long accountId;

    @NotBlank
    private String symbol;

    @NotNull
    private LocalDateTime timestamp;

    /** Free text; "buy" and "sell" settle cash when settlement is requested. */
    @NotBlank
    private String side;

    @NotNull
    private Double quantity;

    @NotNull
    private Double price;

    private Double fee;
    private Double realizedPl;
    private String strategyName;
}
