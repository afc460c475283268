package org.pokernight.dto;

import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BalanceSummaryDTO {
    private String userId;
    /** Pending cents this user still has to pay. */
    private long totalOwes;
    /** Pending cents other players still have to pay this user. */
    private long totalOwed;
    /** totalOwed - totalOwes */
    private long net;
    private List<LedgerEntryDTO> owes;
    private List<LedgerEntryDTO> owed;
}
