package com.tradestore.api.dto.request;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Optional body for closing a position; closedAt defaults to now. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionCloseRequest {

    private LocalDateTime closedAt;
}
