package com.tradestore.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the accounts table.
 * The primary key is assigned by the caller. Balance columns default to 0 and
 * created_at to the insert time, both here and in the DDL for non-JPA writers.
 */
@Entity
@Table(name = "accounts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountEntity {

    @Id
    @Column(name = "account_id")
    private Long accountId;

    @Column(nullable = false)
    private String owner;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "cash_balance", nullable = false)
    private Double cashBalance;

    @Column(name = "margin_requirement", nullable = false)
    private Double marginRequirement;

    @Column(name = "margin_used", nullable = false)
    private Double marginUsed;

    @Column(name = "last_update")
    private LocalDateTime lastUpdate;

    @PrePersist
    void applyDefaults() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (cashBalance == null) {
            cashBalance = 0.0;
        }
        if (marginRequirement == null) {
            marginRequirement = 0.0;
        }
        if (marginUsed == null) {
            marginUsed = 0.0;
        }
    }
}
