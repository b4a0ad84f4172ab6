package com.tradestore.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Where an incremental collector should resume for a symbol/interval pair.
 * latestOpenTime is null when nothing is stored yet.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NextFetchStartResponse {

    private String symbol;
    private String interval;
    private LocalDateTime latestOpenTime;
    private LocalDateTime nextFetchStart;
}
