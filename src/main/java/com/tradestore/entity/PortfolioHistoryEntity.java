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
 * JPA entity for the portfolio_history table.
 * Append-only valuation snapshots, one account per row.
 */
@Entity
@Immutable
@Table(name = "portfolio_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "record_id")
    private Long recordId;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "portfolio_value", nullable = false)
    private Double portfolioValue;

    @Column(name = "long_exposure")
    private Double longExposure;

    @Column(name = "short_exposure")
    private Double shortExposure;

    @Column(name = "gross_exposure")
    private Double grossExposure;

    @Column(name = "net_exposure")
    private Double netExposure;

    @Column(name = "long_short_ratio")
    private Double longShortRatio;
}
