package com.tradestore.api.controller;

import com.tradestore.api.dto.request.TradeRequest;
import com.tradestore.api.dto.response.TradeResponse;
import com.tradestore.domain.model.Trade;
import com.tradestore.exception.BusinessException;
import com.tradestore.exception.ErrorCode;
import com.tradestore.mapper.TradeMapper;
import com.tradestore.service.TradeService;
import jakarta.validation.Valid;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the append-only trade journal.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/trades[?settle=true]} -- append a trade, optionally settling cash</li>
 *   <li>{@code GET  /api/trades/{tradeId}} -- get one trade</li>
 *   <li>{@code GET  /api/trades?accountId=&symbol=&from=&to=} -- list an account's trades</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/trades")
public class TradeController {

    private final TradeService tradeService;
    private final TradeMapper tradeMapper;

    public TradeController(TradeService tradeService, TradeMapper tradeMapper) {
        this.tradeService = tradeService;
        this.tradeMapper = tradeMapper;
    }

    @PostMapping
    public ResponseEntity<TradeResponse> record(
            @RequestBody @Valid TradeRequest request, @RequestParam(defaultValue = "false") boolean settle) {
        Trade trade = tradeMapper.toDomain(request);
        Trade recorded = settle ? tradeService.recordTradeAndSettle(trade) : tradeService.recordTrade(trade);
        return ResponseEntity.status(HttpStatus.CREATED).body(tradeMapper.toResponse(recorded));
    }

    @GetMapping("/{tradeId}")
    public ResponseEntity<TradeResponse> get(@PathVariable Long tradeId) {
        return ResponseEntity.ok(tradeMapper.toResponse(tradeService.getTrade(tradeId)));
    }

    /** The time window is inclusive and needs both bounds; it combines with a symbol filter. */
    @GetMapping
    public ResponseEntity<List<TradeResponse>> list(
            @RequestParam Long accountId,
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        if ((from == null) != (to == null)) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Trade time window needs both 'from' and 'to'",
                    Map.of("from", String.valueOf(from), "to", String.valueOf(to)));
        }
        boolean windowed = from != null;
        List<Trade> trades;
        if (symbol != null && windowed) {
            trades = tradeService.listTrades(accountId, symbol, from, to);
        } else if (symbol != null) {
            trades = tradeService.listTrades(accountId, symbol);
        } else if (windowed) {
            trades = tradeService.listTrades(accountId, from, to);
        } else {
            trades = tradeService.listTrades(accountId);
        }
        return ResponseEntity.ok(tradeMapper.toResponseList(trades));
    }
}
