package com.tradestore.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradestore.exception.BusinessException;
import com.tradestore.exception.ErrorCode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec for the free-form metrics blob attached to a strategy signal.
 *
 * <p>An empty map and null both map to a null column value.
 */
public final class MetricsJson {

    private static final Logger log = LoggerFactory.getLogger(MetricsJson.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final TypeReference<Map<String, Object>> METRICS_TYPE = new TypeReference<>() {};

    private MetricsJson() {}

    public static String write(Map<String, Object> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Signal metrics are not JSON-serializable", e);
        }
    }

    public static Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, METRICS_TYPE);
        } catch (JsonProcessingException e) {
            // stored blob is corrupt; surface it as a server-side fault
            log.error("Unreadable metrics column: {}", json, e);
            throw new IllegalStateException("Stored signal metrics are not valid JSON", e);
        }
    }
}
