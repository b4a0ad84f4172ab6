package com.tradestore.domain.model;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * One decision emitted by a named strategy on one evaluation tick.
 *
 * <p>{@code metrics} has no fixed structure; it is persisted as a JSON text blob and handed
 * back as a plain map.
 */
@Data
@Builder
public class StrategySignal {

    private Long signalId;
    private String symbol;
    private String interval;
    private LocalDateTime timestamp;
    private String strategyName;

    /** Free text, typically "buy", "sell" or "hold". */
    private String signal;

    private Double confidence;
    private Map<String, Object> metrics;
}
