package org.pokernight.repo;

import org.pokernight.model.LedgerEntry;
import org.pokernight.model.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {
    List<LedgerEntry> findByGameIdOrderBySequenceAsc(String gameId);

    List<LedgerEntry> findByFromUserAndStatusOrderByCreatedAtDesc(String fromUser, PaymentStatus status);

    List<LedgerEntry> findByToUserAndStatusOrderByCreatedAtDesc(String toUser, PaymentStatus status);

    long countByGameId(String gameId);
}
