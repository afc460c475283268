package org.pokernight.repo;

import org.pokernight.model.GameSettlement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface GameSettlementRepository extends JpaRepository<GameSettlement, Long> {
    Optional<GameSettlement> findByGameId(String gameId);

    // UNSETTLED -> SETTLING, or takes over a SETTLING claim abandoned before staleBefore
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update GameSettlement s set s.status = org.pokernight.model.SettlementStatus.SETTLING, " +
            "s.claimToken = :token, s.updatedAt = :now " +
            "where s.gameId = :gameId and (s.status = org.pokernight.model.SettlementStatus.UNSETTLED " +
            "or (s.status = org.pokernight.model.SettlementStatus.SETTLING and s.updatedAt < :staleBefore))")
    int claim(@Param("gameId") String gameId, @Param("token") String token,
              @Param("now") Instant now, @Param("staleBefore") Instant staleBefore);

    // SETTLING -> SETTLED, only for the caller still holding the claim
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update GameSettlement s set s.status = org.pokernight.model.SettlementStatus.SETTLED, " +
            "s.claimToken = null, s.updatedAt = :now, s.settledAt = :now " +
            "where s.gameId = :gameId and s.status = org.pokernight.model.SettlementStatus.SETTLING " +
            "and s.claimToken = :token")
    int complete(@Param("gameId") String gameId, @Param("token") String token, @Param("now") Instant now);

    // SETTLING -> UNSETTLED, only for the caller still holding the claim
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update GameSettlement s set s.status = org.pokernight.model.SettlementStatus.UNSETTLED, " +
            "s.claimToken = null, s.updatedAt = :now " +
            "where s.gameId = :gameId and s.status = org.pokernight.model.SettlementStatus.SETTLING " +
            "and s.claimToken = :token")
    int release(@Param("gameId") String gameId, @Param("token") String token, @Param("now") Instant now);
}
