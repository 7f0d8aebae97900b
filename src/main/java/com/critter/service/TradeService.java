package com.critter.service;

import com.critter.config.GameProperties;
import com.critter.coordination.CoordinationKeys;
import com.critter.coordination.CoordinationStore;
import com.critter.coordination.LockToken;
import com.critter.dto.TradeDTO;
import com.critter.dto.TradeOfferRequest;
import com.critter.dto.TradeResult;
import com.critter.event.TradeSettledEvent;
import com.critter.exception.StaleOfferException;
import com.critter.model.Trade;
import com.critter.model.TradeStatus;
import com.critter.repository.TradeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Service for the two-party trade escrow: propose, counter offer, confirm, cancel.
 * Mutations of one trade are serialized through its coordination-store lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeService {

    private static final Set<TradeStatus> OPEN = EnumSet.of(TradeStatus.PROPOSED, TradeStatus.PARTIALLY_CONFIRMED);

    private final TradeRepository tradeRepository;
    private final TradeSettlementExecutor executor;
    private final TrainerService trainerService;
    private final CoordinationStore coordinationStore;
    private final GameProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Open a trade with the proposer's offer.
     *
     * @throws IllegalArgumentException if either trainer is unknown or the offer is not held by the proposer
     */
    public TradeResult propose(Long proposerId, Long counterpartyId, TradeOfferRequest offer) {
        if (proposerId == null || counterpartyId == null) {
            throw new IllegalArgumentException("Both trainers are required");
        }
        if (proposerId.equals(counterpartyId)) {
            throw new IllegalArgumentException("Cannot trade with yourself");
        }
        trainerService.getTrainer(proposerId);
        trainerService.getTrainer(counterpartyId);

        Instant now = clock.instant();
        Trade trade = executor.create(proposerId, counterpartyId, offer, now, now.plus(properties.trade().expiry()));
        log.info("Trade {} proposed by {} to {}", trade.getId(), proposerId, counterpartyId);
        return TradeResult.of(TradeResult.Outcome.PROPOSED, TradeDTO.fromTrade(trade));
    }

    public TradeResult addCounterOffer(String tradeId, Long userId, TradeOfferRequest offer) {
        return underLock(tradeId, () -> {
            TradeSettlementExecutor.Step step = executor.counterOffer(tradeId, userId, offer, clock.instant());
            return result(step.outcome(), step.trade());
        });
    }

    /**
     * Confirm a trade. Re-confirming is a no-op. When both parties have confirmed, every offered
     * holding changes owner at once, or nothing does and the trade is cancelled as stale.
     */
    public TradeResult confirm(String tradeId, Long userId) {
        return underLock(tradeId, () -> {
            try {
                TradeSettlementExecutor.Step step = executor.confirm(tradeId, userId, clock.instant());
                return result(step.outcome(), step.trade());
            } catch (StaleOfferException e) {
                log.warn("Trade {} cancelled, stale offer: {}", tradeId, e.getMessage());
                Trade cancelled = executor.cancelStale(tradeId, "Stale offer: " + e.getMessage(), clock.instant());
                return result(TradeResult.Outcome.STALE_OFFER, cancelled);
            }
        });
    }

    public TradeResult cancel(String tradeId, Long userId) {
        return underLock(tradeId, () -> {
            TradeSettlementExecutor.Step step = executor.cancel(tradeId, userId, clock.instant());
            return result(step.outcome(), step.trade());
        });
    }

    /**
     * Trade state, applying expiry if the deadline has passed.
     */
    public TradeDTO getTrade(String tradeId) {
        Trade trade = tradeRepository.findById(tradeId)
                .orElseThrow(() -> new IllegalArgumentException("Trade not found: " + tradeId));
        if (!trade.getStatus().isTerminal() && trade.isPastDeadline(clock.instant())) {
            Optional<Trade> expired = expire(tradeId);
            if (expired.isPresent()) {
                return TradeDTO.fromTrade(expired.get());
            }
        }
        return TradeDTO.fromTrade(trade);
    }

    public List<TradeDTO> listOpenTrades(Long userId) {
        return tradeRepository.findOpenTradesFor(userId, OPEN).stream()
                .map(TradeDTO::fromTrade)
                .toList();
    }

    /**
     * Sweep safety net; every read and command applies expiry on its own.
     */
    public int expireOverdueTrades() {
        int expired = 0;
        for (Trade trade : tradeRepository.findByStatusInAndExpiresAtLessThanEqual(OPEN, clock.instant())) {
            if (expire(trade.getId()).isPresent()) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} overdue trade(s)", expired);
        }
        return expired;
    }

    private Optional<Trade> expire(String tradeId) {
        Optional<Trade> expired = coordinationStore.withLock(CoordinationKeys.tradeLock(tradeId),
                properties.trade().lockTtl(), () -> executor.expireIfOverdue(tradeId, clock.instant()));
        expired.ifPresent(t -> eventPublisher.publishEvent(new TradeSettledEvent(TradeDTO.fromTrade(t))));
        return expired;
    }

    private TradeResult underLock(String tradeId, Supplier<TradeResult> action) {
        Optional<LockToken> lock = coordinationStore.tryAcquire(
                CoordinationKeys.tradeLock(tradeId), properties.trade().lockTtl());
        if (lock.isEmpty()) {
            log.debug("Trade {} is busy", tradeId);
            Trade trade = tradeRepository.findById(tradeId)
                    .orElseThrow(() -> new IllegalArgumentException("Trade not found: " + tradeId));
            return result(TradeResult.Outcome.CONTENDED, trade);
        }
        try {
            return action.get();
        } finally {
            coordinationStore.release(lock.get());
        }
    }

    private TradeResult result(TradeResult.Outcome outcome, Trade trade) {
        TradeDTO dto = TradeDTO.fromTrade(trade);
        switch (outcome) {
            case SETTLED, STALE_OFFER, CANCELLED -> eventPublisher.publishEvent(new TradeSettledEvent(dto));
            case EXPIRED -> {
                if (trade.getStatus() == TradeStatus.EXPIRED) {
                    eventPublisher.publishEvent(new TradeSettledEvent(dto));
                }
            }
            default -> {
            }
        }
        if (outcome == TradeResult.Outcome.SETTLED) {
            log.info("Trade {} confirmed by both parties and settled", trade.getId());
        }
        return TradeResult.of(outcome, dto);
    }
}
