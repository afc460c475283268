package org.pokernight.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkPaidRequest {
    @NotBlank
    private String userId;      // payer or payee acknowledging the transfer
    private boolean paid = true;
}
