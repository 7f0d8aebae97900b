package com.critter.repository;

import com.critter.model.Creature;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Repository for Creature entities.
 */
@Repository
public interface CreatureRepository extends JpaRepository<Creature, String> {

    List<Creature> findByOwnerIdOrderByCreatedAtAsc(Long ownerId);

    long countByOwnerId(Long ownerId);

    List<Creature> findByIdInAndOwnerId(Collection<String> ids, Long ownerId);

    /**
     * Moves a creature to a new owner only if it still belongs to {@code fromOwner}.
     * The creature leaves any team it was in.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Creature c SET c.ownerId = :toOwner, c.inTeam = false, c.version = c.version + 1 "
            + "WHERE c.id = :creatureId AND c.ownerId = :fromOwner")
    int transferOwnership(String creatureId, Long fromOwner, Long toOwner);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Creature c SET c.inTeam = :inTeam, c.version = c.version + 1 "
            + "WHERE c.ownerId = :ownerId AND c.id IN :creatureIds")
    int updateTeamFlag(Long ownerId, Collection<String> creatureIds, boolean inTeam);
}
