package com.tradestore.api.controller;

import com.tradestore.api.dto.request.StrategySignalRequest;
import com.tradestore.api.dto.response.StrategySignalResponse;
import com.tradestore.domain.model.StrategySignal;
import com.tradestore.exception.ResourceNotFoundException;
import com.tradestore.mapper.StrategySignalMapper;
import com.tradestore.service.StrategySignalService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for strategy signals.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/signals} -- record a signal</li>
 *   <li>{@code GET  /api/signals?strategyName=&symbol=&interval=} -- a strategy's signals, newest first</li>
 *   <li>{@code GET  /api/signals/latest?strategyName=&symbol=&interval=} -- most recent signal</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/signals")
public class StrategySignalController {

    private final StrategySignalService strategySignalService;
    private final StrategySignalMapper strategySignalMapper;

    public StrategySignalController(
            StrategySignalService strategySignalService, StrategySignalMapper strategySignalMapper) {
        this.strategySignalService = strategySignalService;
        this.strategySignalMapper = strategySignalMapper;
    }

    @PostMapping
    public ResponseEntity<StrategySignalResponse> record(@RequestBody @Valid StrategySignalRequest request) {
        StrategySignal recorded = strategySignalService.recordSignal(strategySignalMapper.toDomain(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(strategySignalMapper.toResponse(recorded));
    }

    @GetMapping
    public ResponseEntity<List<StrategySignalResponse>> list(
            @RequestParam String strategyName,
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) String interval) {
        List<StrategySignal> signals = strategySignalService.listSignals(strategyName, symbol, interval);
        return ResponseEntity.ok(strategySignalMapper.toResponseList(signals));
    }

    @GetMapping("/latest")
    public ResponseEntity<StrategySignalResponse> latest(
            @RequestParam String strategyName, @RequestParam String symbol, @RequestParam String interval) {
        StrategySignal latest = strategySignalService
                .latestSignal(strategyName, symbol, interval)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "StrategySignal", strategyName + "/" + symbol + "/" + interval));
        return ResponseEntity.ok(strategySignalMapper.toResponse(latest));
    }
}
