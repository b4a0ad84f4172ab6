package com.tradestore.api.controller;

import com.tradestore.api.dto.request.PriceBarsRequest;
import com.tradestore.api.dto.response.NextFetchStartResponse;
import com.tradestore.api.dto.response.PriceDatumResponse;
import com.tradestore.domain.model.PriceDatum;
import com.tradestore.mapper.PriceDataMapper;
import com.tradestore.service.PriceDataService;
import jakarta.validation.Valid;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for OHLCV bar series.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/price-data} -- append bars for one symbol/interval</li>
 *   <li>{@code GET  /api/price-data?symbol=&interval=&from=&to=} -- bars in an open-time window</li>
 *   <li>{@code GET  /api/price-data/next-fetch-start?symbol=&interval=} -- where collection resumes</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/price-data")
public class PriceDataController {

    private final PriceDataService priceDataService;
    private final PriceDataMapper priceDataMapper;

    public PriceDataController(PriceDataService priceDataService, PriceDataMapper priceDataMapper) {
        this.priceDataService = priceDataService;
        this.priceDataMapper = priceDataMapper;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> save(@RequestBody @Valid PriceBarsRequest request) {
        List<PriceDatum> bars = priceDataMapper.toDomainBars(request.getBars());
        int saved = priceDataService.saveBars(request.getSymbol(), request.getInterval(), bars);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of(
                        "symbol", PriceDataService.normalizeSymbol(request.getSymbol()),
                        "interval", request.getInterval(),
                        "saved", saved));
    }

    @GetMapping
    public ResponseEntity<List<PriceDatumResponse>> find(
            @RequestParam String symbol,
            @RequestParam String interval,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        List<PriceDatum> bars = priceDataService.findBars(symbol, interval, from, to);
        return ResponseEntity.ok(priceDataMapper.toResponseList(bars));
    }

    @GetMapping("/next-fetch-start")
    public ResponseEntity<NextFetchStartResponse> nextFetchStart(
            @RequestParam String symbol, @RequestParam String interval) {
        LocalDateTime next = priceDataService.nextFetchStart(symbol, interval);
        return ResponseEntity.ok(NextFetchStartResponse.builder()
                .symbol(PriceDataService.normalizeSymbol(symbol))
                .interval(interval)
                .latestOpenTime(priceDataService.latestOpenTime(symbol, interval).orElse(null))
                .nextFetchStart(next)
                .build());
    }
}
