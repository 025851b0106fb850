package com.flagship.letter_workflow.allowance;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AllowanceRepository extends JpaRepository<AllowanceEntity, UUID> {

    /**
     * Loads the user's allowance in the given status with SELECT ... FOR UPDATE.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AllowanceEntity a WHERE a.userId = :userId AND a.status = :status")
    Optional<AllowanceEntity> findByUserIdAndStatusForUpdate(@Param("userId") UUID userId,
                                                             @Param("status") AllowanceStatus status);

    default Optional<AllowanceEntity> findActiveForUpdate(UUID userId) {
        return findByUserIdAndStatusForUpdate(userId, AllowanceStatus.ACTIVE);
    }

    /**
     * Most recent checkout of the user in the given status, locked.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<AllowanceEntity> findFirstByUserIdAndStatusOrderByCreatedAtDesc(UUID userId, AllowanceStatus status);

    Optional<AllowanceEntity> findByUserIdAndStatus(UUID userId, AllowanceStatus status);

    List<AllowanceEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

    long countByUserIdAndStatus(UUID userId, AllowanceStatus status);

    /**
     * Moves every allowance of the user from one status to another, e.g.
     * PENDING checkouts to CANCELED when the checkout session expires.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE AllowanceEntity a
        SET a.status = :to, a.updatedAt = :now
        WHERE a.userId = :userId AND a.status = :from
        """)
    int transitionAll(@Param("userId") UUID userId,
                      @Param("from") AllowanceStatus from,
                      @Param("to") AllowanceStatus to,
                      @Param("now") Instant now);
}
