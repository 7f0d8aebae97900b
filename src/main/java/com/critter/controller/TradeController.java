package com.critter.controller;

import com.critter.dto.CounterOfferRequest;
import com.critter.dto.ProposeTradeRequest;
import com.critter.dto.TradeDTO;
import com.critter.dto.TradeResult;
import com.critter.dto.UserActionRequest;
import com.critter.service.TradeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API controller for trades.
 */
@RestController
@RequestMapping("/api/trades")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class TradeController {

    private final TradeService tradeService;

    @PostMapping
    public ResponseEntity<TradeResult> propose(@Valid @RequestBody ProposeTradeRequest request) {
        log.info("Trade proposed by {} to {}", request.getProposerId(), request.getCounterpartyId());
        return ResponseEntity.ok(tradeService.propose(request.getProposerId(), request.getCounterpartyId(),
                request.getOffer()));
    }

    @GetMapping
    public ResponseEntity<List<TradeDTO>> listOpenTrades(@RequestParam Long userId) {
        return ResponseEntity.ok(tradeService.listOpenTrades(userId));
    }

    @GetMapping("/{tradeId}")
    public ResponseEntity<TradeDTO> getTrade(@PathVariable String tradeId) {
        return ResponseEntity.ok(tradeService.getTrade(tradeId));
    }

    @PostMapping("/{tradeId}/counter")
    public ResponseEntity<TradeResult> counterOffer(@PathVariable String tradeId,
                                                    @Valid @RequestBody CounterOfferRequest request) {
        return ResponseEntity.ok(tradeService.addCounterOffer(tradeId, request.getUserId(), request.getOffer()));
    }

    @PostMapping("/{tradeId}/confirm")
    public ResponseEntity<TradeResult> confirm(@PathVariable String tradeId,
                                               @Valid @RequestBody UserActionRequest request) {
        return ResponseEntity.ok(tradeService.confirm(tradeId, request.getUserId()));
    }

    @PostMapping("/{tradeId}/cancel")
    public ResponseEntity<TradeResult> cancel(@PathVariable String tradeId,
                                              @Valid @RequestBody UserActionRequest request) {
        return ResponseEntity.ok(tradeService.cancel(tradeId, request.getUserId()));
    }
}
