package com.tradestore.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API request DTO for creating an account.
 * Omitted balances are stored as 0.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountCreateRequest {

    /** Caller-assigned account id. */
    @NotNull
    private Long accountId;

    @NotBlank
    private String owner;

    private Double cashBalance;
    private Double marginRequirement;
    private Double marginUsed;
}
