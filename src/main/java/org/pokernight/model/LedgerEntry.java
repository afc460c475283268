package org.pokernight.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "settlement_payment",
        uniqueConstraints = @UniqueConstraint(columnNames = {"game_id", "seq_no"}),
        indexes = {
                @Index(name = "idx_payment_from_user", columnList = "from_user"),
                @Index(name = "idx_payment_to_user", columnList = "to_user")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false, length = 64)
    private String gameId;

    // position in the computed payment list
    @Column(name = "seq_no", nullable = false)
    private int sequence;

    @Column(name = "from_user", nullable = false, length = 64)
    private String fromUser;

    @Column(name = "to_user", nullable = false, length = 64)
    private String toUser;

    @Column(nullable = false)
    private long amount; // cents

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PaymentStatus status;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant paidAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (status == null) status = PaymentStatus.PENDING;
    }
}
