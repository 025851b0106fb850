package com.flagship.letter_workflow.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntryEntity, UUID> {

    List<AuditEntryEntity> findByLetterIdOrderByCreatedAtAscSequenceNumberAsc(UUID letterId);

    List<AuditEntryEntity> findByLetterIdIsNullAndPerformedByOrderBySequenceNumberAsc(UUID performedBy);

    long countByLetterIdAndAction(UUID letterId, String action);
}
