package com.tradestore.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

/**
 * JPA entity for the strategy_signals table.
 * metrics holds the serialized metrics map as opaque text (see StrategySignalMapper).
 */
@Entity
@Immutable
@Table(name = "strategy_signals")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategySignalEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "signal_id")
    private Long signalId;

    @Column(nullable = false)
    private String symbol;

    @Column(name = "interval", nullable = false)
    private String interval;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "strategy_name", nullable = false)
    private String strategyName;

    @Column(nullable = false)
    private String signal;

    private Double confidence;

    private String metrics;
}
