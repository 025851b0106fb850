package com.flagship.letter_workflow.letter;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LetterRepository extends JpaRepository<LetterEntity, UUID> {

    /**
     * SELECT ... FOR UPDATE on one letter; every mutation goes through this.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LetterEntity l WHERE l.id = :id")
    Optional<LetterEntity> findByIdForUpdate(@Param("id") UUID id);

    List<LetterEntity> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

    List<LetterEntity> findByStatusInOrderByCreatedAtAsc(Collection<LetterStatus> statuses);

    long countByStatusIn(Collection<LetterStatus> statuses);

    /**
     * Claims older than the cutoff; these are up for takeover.
     */
    @Query("SELECT COUNT(l) FROM LetterEntity l WHERE l.claimedBy IS NOT NULL AND l.claimedAt < :cutoff")
    long countClaimsOlderThan(@Param("cutoff") Instant cutoff);
}
