package org.pokernight.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pokernight.config.SettlementProperties;
import org.pokernight.dto.SettlementDTO;
import org.pokernight.exception.ConcurrentSettlementException;
import org.pokernight.exception.InvalidRecordException;
import org.pokernight.exception.SettlementException;
import org.pokernight.model.GameSettlement;
import org.pokernight.model.SettlementStatus;
import org.pokernight.model.settlement.NetBalance;
import org.pokernight.model.settlement.PlayerRecord;
import org.pokernight.model.settlement.Transfer;
import org.pokernight.model.settlement.rules.BalanceNormalizer;
import org.pokernight.model.settlement.rules.DebtMinimizer;
import org.pokernight.repo.GameSettlementRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Settles a finished game exactly once.
 *
 * <p>Callers race on the game's {@code game_settlement} row: the one whose conditional
 * update moves it UNSETTLED -> SETTLING computes and persists the payments, everyone
 * else waits for the row to reach SETTLED and gets the stored result. A failed attempt
 * puts the row back to UNSETTLED so a corrected retry can go through.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {
    private final GameSettlementRepository settlements;
    private final LedgerService ledgerService;
    private final SettlementProperties props;

    public SettlementDTO settle(String gameId, List<PlayerRecord> records) {
        if (gameId == null || gameId.isBlank()) {
            throw new InvalidRecordException("A game id is required to settle");
        }
        ensureExists(gameId);

        long deadline = System.currentTimeMillis() + props.getWaitTimeout().toMillis();
        while (true) {
            GameSettlement current = settlements.findByGameId(gameId)
                    .orElseThrow(() -> new ConcurrentSettlementException("Settlement row for game " + gameId + " disappeared"));

            if (current.getStatus() == SettlementStatus.SETTLED) {
                log.info("Game {} already settled, returning stored settlement", gameId);
                return ledgerService.getSettlement(gameId);
            }

            String token = UUID.randomUUID().toString();
            if (claim(gameId, token)) {
                return computeAndPersist(gameId, records, token);
            }

            if (System.currentTimeMillis() > deadline) {
                log.warn("Gave up waiting for in-flight settlement of game {}", gameId);
                throw new ConcurrentSettlementException("Game " + gameId + " is still being settled, retry later");
            }
            log.debug("Game {} is being settled by another caller, waiting", gameId);
            try {
                Thread.sleep(props.getPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConcurrentSettlementException("Interrupted while waiting for settlement of game " + gameId, e);
            }
        }
    }

    public SettlementDTO getSettlement(String gameId) {
        return ledgerService.getSettlement(gameId);
    }

    private SettlementDTO computeAndPersist(String gameId, List<PlayerRecord> records, String token) {
        List<Transfer> transfers;
        try {
            List<NetBalance> balances = BalanceNormalizer.normalize(records, props.getRoundingTolerancePerPlayerCents());
            transfers = DebtMinimizer.minimize(balances);
        } catch (SettlementException e) {
            log.warn("Settlement of game {} rejected: {}", gameId, e.getMessage());
            release(gameId, token, e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Settlement of game {} failed unexpectedly", gameId, e);
            release(gameId, token, e);
            throw e;
        }

        try {
            return ledgerService.writeSettlement(gameId, transfers, token);
        } catch (ConcurrentSettlementException e) {
            // claim already taken over, nothing of ours to release
            log.warn("Lost settlement claim on game {}", gameId);
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Could not persist settlement of game {}", gameId, e);
            ConcurrentSettlementException failure =
                    new ConcurrentSettlementException("Could not persist settlement of game " + gameId, e);
            release(gameId, token, failure);
            throw failure;
        }
    }

    private void ensureExists(String gameId) {
        if (settlements.findByGameId(gameId).isPresent()) return;
        try {
            settlements.saveAndFlush(GameSettlement.unsettled(gameId));
        } catch (DataAccessException e) {
            // unique game_id: a concurrent caller inserted first
            if (settlements.findByGameId(gameId).isPresent()) {
                log.debug("Settlement row for game {} created concurrently", gameId);
                return;
            }
            throw new ConcurrentSettlementException("Could not open settlement for game " + gameId, e);
        }
    }

    private boolean claim(String gameId, String token) {
        Instant now = Instant.now();
        Instant staleBefore = now.minus(props.getStaleClaimAfter());
        try {
            boolean won = settlements.claim(gameId, token, now, staleBefore) == 1;
            if (won) log.info("Claimed settlement of game {}", gameId);
            return won;
        } catch (DataAccessException e) {
            throw new ConcurrentSettlementException("Could not claim settlement of game " + gameId, e);
        }
    }

    private void release(String gameId, String token, RuntimeException cause) {
        try {
            if (settlements.release(gameId, token, Instant.now()) == 1) {
                log.info("Released settlement claim on game {}", gameId);
            }
        } catch (DataAccessException e) {
            log.error("Could not release settlement claim on game {}", gameId, e);
            cause.addSuppressed(e);
        }
    }
}
