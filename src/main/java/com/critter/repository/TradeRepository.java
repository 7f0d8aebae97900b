package com.critter.repository;

import com.critter.model.Trade;
import com.critter.model.TradeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for Trade entities.
 */
@Repository
public interface TradeRepository extends JpaRepository<Trade, String> {

    List<Trade> findByStatusInAndExpiresAtLessThanEqual(Collection<TradeStatus> statuses, Instant cutoff);

    @Query("SELECT t FROM Trade t WHERE t.status IN :statuses "
            + "AND (t.proposerId = :trainerId OR t.counterpartyId = :trainerId) ORDER BY t.createdAt DESC")
    List<Trade> findOpenTradesFor(Long trainerId, Collection<TradeStatus> statuses);
}
