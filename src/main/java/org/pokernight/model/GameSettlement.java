package org.pokernight.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Settlement state of one game. The row is the single point of coordination
 * between callers settling the same game: status only moves through the
 * conditional updates of {@link org.pokernight.repo.GameSettlementRepository}.
 */
@Entity
@Table(name = "game_settlement")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameSettlement {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", unique = true, nullable = false, length = 64)
    private String gameId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SettlementStatus status;

    // owner of the current SETTLING claim, null otherwise
    @Column(length = 36)
    private String claimToken;

    @Column(nullable = false)
    private Instant updatedAt;

    private Instant settledAt;

    public static GameSettlement unsettled(String gameId) {
        return GameSettlement.builder()
                .gameId(gameId)
                .status(SettlementStatus.UNSETTLED)
                .updatedAt(Instant.now())
                .build();
    }
}
