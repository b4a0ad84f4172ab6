package com.tradestore.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradestore.api.controller.PriceDataController;
import com.tradestore.config.ApiResponseAdvice;
import com.tradestore.config.StoreConfig;
import com.tradestore.domain.model.PriceDatum;
import com.tradestore.exception.BusinessException;
import com.tradestore.exception.ErrorCode;
import com.tradestore.exception.GlobalExceptionHandler;
import com.tradestore.mapper.PriceDataMapper;
import com.tradestore.service.PriceDataService;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PriceDataControllerTest {

    private static final String BAR_JSON = "{\"openTime\":\"2024-01-01T00:00:00\",\"open\":42000.0,\"high\":42500.0,"
            + "\"low\":41800.0,\"close\":42300.0,\"volume\":120.5,\"closeTime\":\"2024-01-01T00:59:59\","
            + "\"quoteVolume\":5090000.0,\"count\":3100,\"takerBuyVolume\":60.2,\"takerBuyQuoteVolume\":2545000.0}";

    private MockMvc mockMvc;

    @Mock
    private PriceDataService priceDataService;

    @BeforeEach
    void setUp() {
        PriceDataController controller =
                new PriceDataController(priceDataService, Mappers.getMapper(PriceDataMapper.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(new StoreConfig()), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/price-data saves a bar series and reports the normalized symbol")
    @SuppressWarnings("unchecked")
    void saveBars() throws Exception {
        when(priceDataService.saveBars(eq("BTC/USDT"), eq("1h"), anyList())).thenReturn(2);

        mockMvc.perform(post("/api/price-data")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTC/USDT\",\"interval\":\"1h\",\"bars\":[" + BAR_JSON + "," + BAR_JSON
                                + "]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.symbol").value("BTCUSDT"))
                .andExpect(jsonPath("$.data.interval").value("1h"))
                .andExpect(jsonPath("$.data.saved").value(2));

        ArgumentCaptor<List<PriceDatum>> captor = ArgumentCaptor.forClass(List.class);
        verify(priceDataService).saveBars(eq("BTC/USDT"), eq("1h"), captor.capture());
        assertThat(captor.getValue()).hasSize(2);
        assertThat(captor.getValue().get(0).getCount()).isEqualTo(3100);
        assertThat(captor.getValue().get(0).getTakerBuyQuoteVolume()).isEqualTo(2545000.0);
    }

    @Test
    @DisplayName("POST /api/price-data rejects a bar without a close")
    void saveBarsValidatesNestedBars() throws Exception {
        mockMvc.perform(post("/api/price-data")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"interval\":\"1h\",\"bars\":[{\"openTime\":"
                                + "\"2024-01-01T00:00:00\",\"open\":1.0,\"high\":1.0,\"low\":1.0,\"volume\":1.0,"
                                + "\"closeTime\":\"2024-01-01T00:59:59\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("POST /api/price-data rejects a null entry in the bar list")
    void saveBarsRejectsNullEntry() throws Exception {
        mockMvc.perform(post("/api/price-data")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"interval\":\"1h\",\"bars\":[" + BAR_JSON + ",null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        verifyNoInteractions(priceDataService);
    }

    @Test
    @DisplayName("GET /api/price-data returns bars in the window")
    void findBars() throws Exception {
        LocalDateTime from = LocalDateTime.of(2024, 1, 1, 0, 0);
        LocalDateTime to = LocalDateTime.of(2024, 1, 2, 0, 0);
        when(priceDataService.findBars("BTCUSDT", "1h", from, to))
                .thenReturn(List.of(PriceDatum.builder()
                        .id(1L)
                        .symbol("BTCUSDT")
                        .interval("1h")
                        .openTime(from)
                        .close(42300.0)
                        .build()));

        mockMvc.perform(get("/api/price-data")
                        .param("symbol", "BTCUSDT")
                        .param("interval", "1h")
                        .param("from", "2024-01-01T00:00:00")
                        .param("to", "2024-01-02T00:00:00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].close").value(42300.0));
    }

    @Test
    @DisplayName("GET /api/price-data/next-fetch-start reports latest and next open time")
    void nextFetchStart() throws Exception {
        LocalDateTime latest = LocalDateTime.of(2024, 1, 1, 4, 0, 0);
        when(priceDataService.nextFetchStart("BTC/USDT", "4h")).thenReturn(latest.plusHours(4));
        when(priceDataService.latestOpenTime("BTC/USDT", "4h")).thenReturn(Optional.of(latest));

        mockMvc.perform(get("/api/price-data/next-fetch-start").param("symbol", "BTC/USDT").param("interval", "4h"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.symbol").value("BTCUSDT"))
                .andExpect(jsonPath("$.data.latestOpenTime").exists())
                .andExpect(jsonPath("$.data.nextFetchStart").exists());
    }

    @Test
    @DisplayName("GET /api/price-data/next-fetch-start with an unknown interval returns 400")
    void nextFetchStartUnknownInterval() throws Exception {
        when(priceDataService.nextFetchStart("BTCUSDT", "7x"))
                .thenThrow(new BusinessException(ErrorCode.VALIDATION_ERROR, "Unknown kline interval: 7x"));

        mockMvc.perform(get("/api/price-data/next-fetch-start").param("symbol", "BTCUSDT").param("interval", "7x"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Unknown kline interval: 7x"));
    }
}
