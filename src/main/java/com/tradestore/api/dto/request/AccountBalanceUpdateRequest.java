package com.tradestore.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API request DTO for overwriting an account's cash and margin state.
 * Null fields are left unchanged.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountBalanceUpdateRequest {

    private Double cashBalance;
    private Double marginRequirement;
    private Double marginUsed;
}
