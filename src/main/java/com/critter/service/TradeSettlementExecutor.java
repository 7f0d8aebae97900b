package com.critter.service;

import com.critter.config.Catalog;
import com.critter.dto.TradeOfferRequest;
import com.critter.dto.TradeResult;
import com.critter.exception.StaleOfferException;
import com.critter.model.Creature;
import com.critter.model.ItemStack;
import com.critter.model.Trade;
import com.critter.model.TradeStatus;
import com.critter.model.Trainer;
import com.critter.repository.CreatureRepository;
import com.critter.repository.TradeRepository;
import com.critter.repository.TrainerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Transactional steps of the trade escrow. The exchange moves every creature, item and coin of
 * both offers in one transaction; a single missing holding throws {@link StaleOfferException}
 * and the whole transaction, including the confirmation that triggered it, rolls back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Transactional
public class TradeSettlementExecutor {

    private final TradeRepository tradeRepository;
    private final CreatureRepository creatureRepository;
    private final TrainerRepository trainerRepository;
    private final InventoryService inventoryService;
    private final Catalog catalog;

    public record Step(TradeResult.Outcome outcome, Trade trade) {}

    public Trade create(Long proposerId, Long counterpartyId, TradeOfferRequest offer, Instant now, Instant expiresAt) {
        validateOffer(proposerId, offer);
        return tradeRepository.save(Trade.builder()
                .proposerId(proposerId)
                .counterpartyId(counterpartyId)
                .status(TradeStatus.PROPOSED)
                .proposerCreatureIds(new LinkedHashSet<>(offer.getCreatureIds()))
                .proposerItems(toStacks(offer.getItems()))
                .proposerCoins(offer.getCoins())
                .createdAt(now)
                .expiresAt(expiresAt)
                .build());
    }

    public Step counterOffer(String tradeId, Long userId, TradeOfferRequest offer, Instant now) {
        Trade trade = load(tradeId);
        requireParty(trade, userId);
        if (!userId.equals(trade.getCounterpartyId())) {
            throw new IllegalArgumentException("Only the counterparty can submit a counter offer");
        }
        Step closed = closedOrExpired(trade, now);
        if (closed != null) {
            return closed;
        }
        if (trade.getStatus() != TradeStatus.PROPOSED) {
            throw new IllegalStateException("Counter offer already submitted");
        }
        validateOffer(userId, offer);
        if (offer.isEmpty() && trade.getProposerCreatureIds().isEmpty()
                && trade.getProposerItems().isEmpty() && trade.getProposerCoins() == 0) {
            throw new IllegalArgumentException("Both offers are empty; nothing to trade");
        }

        trade.setCounterpartyCreatureIds(new LinkedHashSet<>(offer.getCreatureIds()));
        trade.setCounterpartyItems(toStacks(offer.getItems()));
        trade.setCounterpartyCoins(offer.getCoins());
        trade.setCounterOfferSubmitted(true);
        trade.setStatus(TradeStatus.PARTIALLY_CONFIRMED);
        return new Step(TradeResult.Outcome.COUNTER_OFFERED, tradeRepository.save(trade));
    }

    /**
     * Record a confirmation and, once both parties have confirmed, perform the exchange.
     *
     * @throws StaleOfferException   if any offered holding moved since it was offered
     * @throws IllegalStateException if the counter offer has not been submitted yet
     */
    public Step confirm(String tradeId, Long userId, Instant now) {
        Trade trade = load(tradeId);
        requireParty(trade, userId);

        if (trade.getStatus() == TradeStatus.CONFIRMED) {
            return new Step(TradeResult.Outcome.ALREADY_CONFIRMED, trade);
        }
        Step closed = closedOrExpired(trade, now);
        if (closed != null) {
            return closed;
        }
        if (trade.getStatus() == TradeStatus.PROPOSED) {
            throw new IllegalStateException("Trade cannot be confirmed before the counter offer is submitted");
        }
        if (trade.hasConfirmed(userId)) {
            return new Step(TradeResult.Outcome.ALREADY_CONFIRMED, trade);
        }

        trade.markConfirmed(userId);
        if (!trade.bothConfirmed()) {
            return new Step(TradeResult.Outcome.CONFIRMATION_RECORDED, tradeRepository.save(trade));
        }

        tradeRepository.saveAndFlush(trade);
        exchange(trade);

        // bulk transfers cleared the persistence context
        Trade settled = load(tradeId);
        settled.setStatus(TradeStatus.CONFIRMED);
        settled.setSettledAt(now);
        return new Step(TradeResult.Outcome.SETTLED, tradeRepository.save(settled));
    }

    /**
     * @throws IllegalStateException if the trade already settled
     */
    public Step cancel(String tradeId, Long userId, Instant now) {
        Trade trade = load(tradeId);
        requireParty(trade, userId);
        if (trade.getStatus() == TradeStatus.CONFIRMED) {
            throw new IllegalStateException("Trade already confirmed");
        }
        Step closed = closedOrExpired(trade, now);
        if (closed != null) {
            return closed;
        }
        trade.setStatus(TradeStatus.CANCELLED);
        trade.setCancelReason("Cancelled by " + userId);
        trade.setSettledAt(now);
        return new Step(TradeResult.Outcome.CANCELLED, tradeRepository.save(trade));
    }

    /**
     * Cancel after a failed exchange. Runs in a fresh transaction; the failed one rolled back.
     */
    public Trade cancelStale(String tradeId, String reason, Instant now) {
        Trade trade = load(tradeId);
        if (trade.getStatus().isTerminal()) {
            return trade;
        }
        trade.setStatus(TradeStatus.CANCELLED);
        trade.setCancelReason(reason);
        trade.setSettledAt(now);
        return tradeRepository.save(trade);
    }

    /**
     * @return the trade if this call moved it to EXPIRED
     */
    public Trade expireIfOverdue(String tradeId, Instant now) {
        Trade trade = load(tradeId);
        if (trade.getStatus().isTerminal() || !trade.isPastDeadline(now)) {
            return null;
        }
        trade.setStatus(TradeStatus.EXPIRED);
        trade.setSettledAt(now);
        return tradeRepository.save(trade);
    }

    @Transactional(readOnly = true)
    public void validateOffer(Long ownerId, TradeOfferRequest offer) {
        if (offer == null) {
            throw new IllegalArgumentException("Offer is required");
        }
        if (offer.getCoins() < 0) {
            throw new IllegalArgumentException("Coins offered must not be negative");
        }
        Set<String> creatureIds = offer.getCreatureIds();
        if (!creatureIds.isEmpty()) {
            Set<String> owned = new HashSet<>();
            for (Creature c : creatureRepository.findByIdInAndOwnerId(creatureIds, ownerId)) {
                owned.add(c.getId());
            }
            for (String id : creatureIds) {
                if (!owned.contains(id)) {
                    throw new IllegalArgumentException("You don't own creature " + id);
                }
            }
        }
        for (Map.Entry<String, Integer> item : offer.getItems().entrySet()) {
            catalog.getItem(item.getKey());
            if (item.getValue() == null || item.getValue() < 1) {
                throw new IllegalArgumentException("Item quantity must be at least 1: " + item.getKey());
            }
            if (inventoryService.quantityOf(ownerId, item.getKey()) < item.getValue()) {
                throw new IllegalArgumentException("Not enough " + item.getKey() + " to offer");
            }
        }
        if (offer.getCoins() > 0) {
            Trainer trainer = trainerRepository.findById(ownerId)
                    .orElseThrow(() -> new IllegalArgumentException("Trainer not found: " + ownerId));
            if (trainer.getCoins() < offer.getCoins()) {
                throw new IllegalArgumentException("Not enough coins to offer " + offer.getCoins());
            }
        }
    }

    private void exchange(Trade trade) {
        Long proposer = trade.getProposerId();
        Long counterparty = trade.getCounterpartyId();

        moveHoldings(proposer, counterparty, trade.getProposerCreatureIds(), trade.getProposerItems(), trade.getProposerCoins());
        moveHoldings(counterparty, proposer, trade.getCounterpartyCreatureIds(), trade.getCounterpartyItems(), trade.getCounterpartyCoins());

        removeFromTeam(proposer, trade.getProposerCreatureIds());
        removeFromTeam(counterparty, trade.getCounterpartyCreatureIds());
        log.info("Trade {} exchanged between {} and {}", trade.getId(), proposer, counterparty);
    }

    private void moveHoldings(Long from, Long to, Set<String> creatureIds, Set<ItemStack> items, long coins) {
        for (String creatureId : creatureIds) {
            if (creatureRepository.transferOwnership(creatureId, from, to) == 0) {
                throw new StaleOfferException("Creature " + creatureId + " is no longer owned by " + from);
            }
        }
        for (ItemStack stack : items) {
            if (!inventoryService.debit(from, stack.getItemCode(), stack.getQuantity())) {
                throw new StaleOfferException("Trainer " + from + " no longer holds " + stack.getQuantity()
                        + " x " + stack.getItemCode());
            }
            inventoryService.credit(to, stack.getItemCode(), stack.getQuantity());
        }
        if (coins > 0) {
            if (trainerRepository.debitCoins(from, coins) == 0) {
                throw new StaleOfferException("Trainer " + from + " no longer has " + coins + " coins");
            }
            trainerRepository.creditCoins(to, coins);
        }
    }

    private void removeFromTeam(Long trainerId, Set<String> creatureIds) {
        if (creatureIds.isEmpty()) {
            return;
        }
        trainerRepository.findById(trainerId).ifPresent(trainer -> {
            if (trainer.getTeam().removeAll(creatureIds)) {
                trainerRepository.save(trainer);
            }
        });
    }

    private Step closedOrExpired(Trade trade, Instant now) {
        if (trade.getStatus().isTerminal()) {
            return new Step(trade.getStatus() == TradeStatus.EXPIRED
                    ? TradeResult.Outcome.EXPIRED
                    : TradeResult.Outcome.NOT_OPEN, trade);
        }
        if (trade.isPastDeadline(now)) {
            trade.setStatus(TradeStatus.EXPIRED);
            trade.setSettledAt(now);
            return new Step(TradeResult.Outcome.EXPIRED, tradeRepository.save(trade));
        }
        return null;
    }

    private void requireParty(Trade trade, Long userId) {
        if (userId == null || !trade.isParty(userId)) {
            throw new IllegalArgumentException("User " + userId + " is not part of trade " + trade.getId());
        }
    }

    private Set<ItemStack> toStacks(Map<String, Integer> items) {
        Set<ItemStack> stacks = new LinkedHashSet<>();
        items.forEach((code, quantity) -> stacks.add(new ItemStack(code, quantity)));
        return stacks;
    }

    private Trade load(String tradeId) {
        return tradeRepository.findById(tradeId)
                .orElseThrow(() -> new IllegalArgumentException("Trade not found: " + tradeId));
    }
}
