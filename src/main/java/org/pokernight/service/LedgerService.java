package org.pokernight.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pokernight.dto.BalanceSummaryDTO;
import org.pokernight.dto.LedgerEntryDTO;
import org.pokernight.dto.SettlementDTO;
import org.pokernight.exception.ConcurrentSettlementException;
import org.pokernight.exception.ErrorCode;
import org.pokernight.exception.SettlementException;
import org.pokernight.model.GameSettlement;
import org.pokernight.model.LedgerEntry;
import org.pokernight.model.PaymentStatus;
import org.pokernight.model.SettlementStatus;
import org.pokernight.model.settlement.Transfer;
import org.pokernight.repo.GameSettlementRepository;
import org.pokernight.repo.LedgerEntryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistence side of a settlement: writes the computed payments, serves them back
 * to the UI and records payers/payees acknowledging a transfer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {
    private final GameSettlementRepository settlements;
    private final LedgerEntryRepository ledger;

    /**
     * Inserts the payment rows and moves the game to SETTLED in one transaction.
     * Rolls back when {@code claimToken} no longer owns the SETTLING claim.
     */
    @Transactional
    public SettlementDTO writeSettlement(String gameId, List<Transfer> transfers, String claimToken) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        List<LedgerEntry> rows = new ArrayList<>(transfers.size());
        for (int i = 0; i < transfers.size(); i++) {
            Transfer t = transfers.get(i);
            rows.add(LedgerEntry.builder()
                    .gameId(gameId)
                    .sequence(i)
                    .fromUser(t.fromUser())
                    .toUser(t.toUser())
                    .amount(t.amount())
                    .status(PaymentStatus.PENDING)
                    .createdAt(now)
                    .build());
        }
        List<LedgerEntry> saved = ledger.saveAll(rows);

        int updated = settlements.complete(gameId, claimToken, now);
        if (updated == 0) {
            throw new ConcurrentSettlementException("Settlement claim on game " + gameId + " was lost before completion");
        }
        log.info("Settled game {} with {} payment(s)", gameId, saved.size());

        return SettlementDTO.builder()
                .gameId(gameId)
                .status(SettlementStatus.SETTLED)
                .payments(saved.stream().map(LedgerEntryDTO::of).toList())
                .settledAt(now)
                .build();
    }

    @Transactional(readOnly = true)
    public SettlementDTO getSettlement(String gameId) {
        GameSettlement s = settlements.findByGameId(gameId)
                .orElseThrow(() -> new SettlementException(ErrorCode.GAME_NOT_FOUND));

        List<LedgerEntryDTO> payments = s.getStatus() == SettlementStatus.SETTLED
                ? ledger.findByGameIdOrderBySequenceAsc(gameId).stream().map(LedgerEntryDTO::of).toList()
                : List.of();

        return SettlementDTO.builder()
                .gameId(gameId)
                .status(s.getStatus())
                .payments(payments)
                .settledAt(s.getSettledAt())
                .build();
    }

    /**
     * Records that a transfer happened (or un-does it). Amounts and parties never change here.
     */
    @Transactional
    public LedgerEntryDTO markPaid(Long ledgerId, String actingUserId, boolean paid) {
        LedgerEntry e = ledger.findById(ledgerId)
                .orElseThrow(() -> new SettlementException(ErrorCode.LEDGER_ENTRY_NOT_FOUND));

        if (!e.getFromUser().equals(actingUserId) && !e.getToUser().equals(actingUserId)) {
            throw new SettlementException(ErrorCode.NOT_A_PARTY);
        }

        e.setStatus(paid ? PaymentStatus.PAID : PaymentStatus.PENDING);
        e.setPaidAt(paid ? Instant.now().truncatedTo(ChronoUnit.MILLIS) : null);
        LedgerEntry saved = ledger.save(e);
        log.info("Payment {} of game {} marked {} by {}", ledgerId, e.getGameId(), saved.getStatus(), actingUserId);
        return LedgerEntryDTO.of(saved);
    }

    /** Outstanding (PENDING) payments for one user across all games. */
    @Transactional(readOnly = true)
    public BalanceSummaryDTO balanceSummary(String userId) {
        List<LedgerEntryDTO> owes = ledger.findByFromUserAndStatusOrderByCreatedAtDesc(userId, PaymentStatus.PENDING)
                .stream().map(LedgerEntryDTO::of).toList();
        List<LedgerEntryDTO> owed = ledger.findByToUserAndStatusOrderByCreatedAtDesc(userId, PaymentStatus.PENDING)
                .stream().map(LedgerEntryDTO::of).toList();

        long totalOwes = owes.stream().mapToLong(LedgerEntryDTO::getAmount).sum();
        long totalOwed = owed.stream().mapToLong(LedgerEntryDTO::getAmount).sum();

        return BalanceSummaryDTO.builder()
                .userId(userId)
                .totalOwes(totalOwes)
                .totalOwed(totalOwed)
                .net(totalOwed - totalOwes)
                .owes(owes)
                .owed(owed)
                .build();
    }
}
