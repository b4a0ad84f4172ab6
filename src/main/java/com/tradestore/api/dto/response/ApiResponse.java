package com.tradestore.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/**
 * Success envelope for store reads and writes. Journal listings also carry {@code count},
 * the number of rows in {@code data}.
 */
@Getter
public final class ApiResponse<T> {

    private final boolean success = true;
    private final T data;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Integer count;

    private final Instant timestamp;

    private ApiResponse(T data, Integer count, Instant timestamp) {
        this.data = data;
        this.count = count;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> wrap(T data, Instant timestamp) {
        Integer count = data instanceof Collection<?> rows ? rows.size() : null;
        return new ApiResponse<>(data, count, timestamp);
    }
}
