package org.pokernight.controller;

import jakarta.validation.Valid;
import org.pokernight.dto.BalanceSummaryDTO;
import org.pokernight.dto.LedgerEntryDTO;
import org.pokernight.dto.MarkPaidRequest;
import org.pokernight.service.LedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    @Autowired
    private LedgerService ledgerService;

    @PutMapping("/{ledgerId}/paid")
    public ResponseEntity<LedgerEntryDTO> markPaid(@PathVariable Long ledgerId,
                                                   @Valid @RequestBody MarkPaidRequest req) {
        return ResponseEntity.ok(ledgerService.markPaid(ledgerId, req.getUserId(), req.isPaid()));
    }

    @GetMapping("/balances")
    public ResponseEntity<BalanceSummaryDTO> balances(@RequestParam String userId) {
        return ResponseEntity.ok(ledgerService.balanceSummary(userId));
    }
}
