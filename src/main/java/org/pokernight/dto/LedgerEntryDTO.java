package org.pokernight.dto;

import lombok.*;
import org.pokernight.model.LedgerEntry;
import org.pokernight.model.PaymentStatus;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerEntryDTO {
    private Long ledgerId;
    private String gameId;
    private String fromUser;
    private String toUser;
    private long amount;          // cents
    private PaymentStatus status;
    private Instant createdAt;
    private Instant paidAt;       // null while PENDING

    public static LedgerEntryDTO of(LedgerEntry e) {
        return LedgerEntryDTO.builder()
                .ledgerId(e.getId())
                .gameId(e.getGameId())
                .fromUser(e.getFromUser())
                .toUser(e.getToUser())
                .amount(e.getAmount())
                .status(e.getStatus())
                .createdAt(e.getCreatedAt())
                .paidAt(e.getPaidAt())
                .build();
    }
}
