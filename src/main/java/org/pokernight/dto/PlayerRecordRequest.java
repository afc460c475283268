package org.pokernight.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.pokernight.model.settlement.PlayerRecord;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerRecordRequest {
    @NotBlank
    private String userId;
    private BigDecimal totalBuyIn;
    private BigDecimal cashOut;   // null = not cashed out yet

    public PlayerRecord toRecord() {
        return new PlayerRecord(userId, totalBuyIn, cashOut);
    }
}
