package com.tradestore.api.controller;

import com.tradestore.api.dto.request.PortfolioSnapshotRequest;
import com.tradestore.api.dto.response.PortfolioHistoryResponse;
import com.tradestore.domain.model.PortfolioHistoryRecord;
import com.tradestore.exception.ResourceNotFoundException;
import com.tradestore.mapper.PortfolioHistoryMapper;
import com.tradestore.service.PortfolioHistoryService;
import jakarta.validation.Valid;
import java.time.LocalDateTime;
import java.util.List;
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
 * REST API for portfolio valuation history.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/portfolio-history} -- record a snapshot</li>
 *   <li>{@code GET  /api/portfolio-history?accountId=&from=&to=} -- snapshots, oldest first</li>
 *   <li>{@code GET  /api/portfolio-history/latest?accountId=} -- most recent snapshot</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/portfolio-history")
public class PortfolioHistoryController {

    private final PortfolioHistoryService portfolioHistoryService;
    private final PortfolioHistoryMapper portfolioHistoryMapper;

    public PortfolioHistoryController(
            PortfolioHistoryService portfolioHistoryService, PortfolioHistoryMapper portfolioHistoryMapper) {
        this.portfolioHistoryService = portfolioHistoryService;
        this.portfolioHistoryMapper = portfolioHistoryMapper;
    }

    @PostMapping
    public ResponseEntity<PortfolioHistoryResponse> record(@RequestBody @Valid PortfolioSnapshotRequest request) {
        PortfolioHistoryRecord recorded =
                portfolioHistoryService.recordSnapshot(portfolioHistoryMapper.toDomain(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(portfolioHistoryMapper.toResponse(recorded));
    }

    @GetMapping
    public ResponseEntity<List<PortfolioHistoryResponse>> list(
            @RequestParam Long accountId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        List<PortfolioHistoryRecord> records = portfolioHistoryService.listSnapshots(accountId, from, to);
        return ResponseEntity.ok(portfolioHistoryMapper.toResponseList(records));
    }

    @GetMapping("/latest")
    public ResponseEntity<PortfolioHistoryResponse> latest(@RequestParam Long accountId) {
        PortfolioHistoryRecord latest = portfolioHistoryService
                .latestSnapshot(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("PortfolioHistoryRecord", "latest for " + accountId));
        return ResponseEntity.ok(portfolioHistoryMapper.toResponse(latest));
    }
}
