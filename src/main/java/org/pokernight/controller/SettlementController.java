package org.pokernight.controller;

import jakarta.validation.Valid;
import org.pokernight.dto.PlayerRecordRequest;
import org.pokernight.dto.SettleRequest;
import org.pokernight.dto.SettlementDTO;
import org.pokernight.service.SettlementService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/games")
public class SettlementController {

    @Autowired
    private SettlementService settlementService;

    // Called by the game lifecycle manager once a game has ended.
    // Safe to repeat: a settled game returns its stored payments.
    @PostMapping("/{gameId}/settle")
    public ResponseEntity<SettlementDTO> settle(@PathVariable String gameId,
                                                @Valid @RequestBody SettleRequest req) {
        var records = req.getPlayers().stream().map(PlayerRecordRequest::toRecord).toList();
        return ResponseEntity.ok(settlementService.settle(gameId, records));
    }

    @GetMapping("/{gameId}/settlement")
    public ResponseEntity<SettlementDTO> settlement(@PathVariable String gameId) {
        return ResponseEntity.ok(settlementService.getSettlement(gameId));
    }
}
