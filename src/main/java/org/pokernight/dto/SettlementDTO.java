package org.pokernight.dto;

import lombok.*;
import org.pokernight.model.SettlementStatus;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettlementDTO {
    private String gameId;
    private SettlementStatus status;
    private List<LedgerEntryDTO> payments;  // in computed order, empty unless SETTLED
    private Instant settledAt;
}
