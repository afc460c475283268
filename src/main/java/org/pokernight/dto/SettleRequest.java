package org.pokernight.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettleRequest {
    @NotNull
    @Valid
    private List<@NotNull PlayerRecordRequest> players;
}
