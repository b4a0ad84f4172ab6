package com.tradestore.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** REST API request DTO for recording one strategy signal. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategySignalRequest {

    @NotBlank
    private String symbol;

    @NotBlank
    private String interval;

    @NotNull
    private LocalDateTime timestamp;

    @NotBlank
    private String strategyName;

    @NotBlank
    private String signal;

    private Double confidence;

    /** Arbitrary strategy output, stored as JSON text. */
    private Map<String, Object> metrics;
}
