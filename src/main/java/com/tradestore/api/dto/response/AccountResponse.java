package com.tradestore.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** REST API response DTO for an account. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountResponse {

    private Long accountId;
    private String owner;
    private LocalDateTime createdAt;
    private Double cashBalance;
    private Double marginRequirement;
    private Double marginUsed;
    private LocalDateTime lastUpdate;

    /** True when margin used exceeds requirement plus cash. Informational only. */
    private boolean marginOverextended;
}
