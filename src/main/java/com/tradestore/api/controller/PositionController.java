package com.tradestore.api.controller;

import com.tradestore.api.dto.request.PositionCloseRequest;
import com.tradestore.api.dto.request.PositionOpenRequest;
import com.tradestore.api.dto.request.PositionUpdateRequest;
import com.tradestore.api.dto.response.PositionResponse;
import com.tradestore.domain.model.Position;
import com.tradestore.mapper.PositionMapper;
import com.tradestore.service.PositionService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for positions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/positions} -- open a position</li>
 *   <li>{@code PUT  /api/positions/{positionId}} -- update quantities/cost bases of an open position</li>
 *   <li>{@code POST /api/positions/{positionId}/close} -- close a position</li>
 *   <li>{@code GET  /api/positions/{positionId}} -- get one position</li>
 *   <li>{@code GET  /api/positions?accountId=&symbol=} -- open positions, or all positions of a symbol</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final PositionService positionService;
    private final PositionMapper positionMapper;

    public PositionController(PositionService positionService, PositionMapper positionMapper) {
        this.positionService = positionService;
        this.positionMapper = positionMapper;
    }

    @PostMapping
    public ResponseEntity<PositionResponse> open(@RequestBody @Valid PositionOpenRequest request) {
        Position opened = positionService.openPosition(positionMapper.toDomain(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(positionMapper.toResponse(opened));
    }

    @PutMapping("/{positionId}")
    public ResponseEntity<PositionResponse> update(
            @PathVariable Long positionId, @RequestBody PositionUpdateRequest request) {
        Position updates = Position.builder()
                .longQty(request.getLongQty())
                .shortQty(request.getShortQty())
                .longCostBasis(request.getLongCostBasis())
                .shortCostBasis(request.getShortCostBasis())
                .shortMarginUsed(request.getShortMarginUsed())
                .build();
        return ResponseEntity.ok(positionMapper.toResponse(positionService.updatePosition(positionId, updates)));
    }

    @PostMapping("/{positionId}/close")
    public ResponseEntity<PositionResponse> close(
            @PathVariable Long positionId, @RequestBody(required = false) PositionCloseRequest request) {
        Position closed = positionService.closePosition(positionId, request != null ? request.getClosedAt() : null);
        return ResponseEntity.ok(positionMapper.toResponse(closed));
    }

    @GetMapping("/{positionId}")
    public ResponseEntity<PositionResponse> get(@PathVariable Long positionId) {
        return ResponseEntity.ok(positionMapper.toResponse(positionService.getPosition(positionId)));
    }

    @GetMapping
    public ResponseEntity<List<PositionResponse>> list(
            @RequestParam Long accountId, @RequestParam(required = false) String symbol) {
        List<Position> positions = symbol != null
                ? positionService.listPositions(accountId, symbol)
                : positionService.listOpenPositions(accountId);
        return ResponseEntity.ok(positionMapper.toResponseList(positions));
    }
}
