package com.tradestore.api.dto.response;

import java.time.LocalDateTime;
import java.util.Map;
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
public class StrategySignalResponse {

    private Long signalId;
    private String symbol;
    private String interval;
    private LocalDateTime timestamp;
    private String strategyName;
    private String signal;
    private Double confidence;
    private Map<String, Object> metrics;
}
