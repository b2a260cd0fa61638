package com.tally.ledger.controller;

import com.tally.common.api.ApiResponse;
import com.tally.ledger.dto.response.AccountBalanceResponse;
import com.tally.ledger.dto.response.BalanceVerificationResponse;
import com.tally.ledger.dto.response.TrialBalanceResponse;
import com.tally.ledger.service.BalanceAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Account balances and ledger reports
 */
@RestController
@RequestMapping("/api/v1/accounting")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Balances", description = "Account balances, trial balance and verification")
public class BalanceController {

    private final BalanceAggregator balanceAggregator;

    @GetMapping("/balances/verification")
    @Operation(summary = "Verify balances",
               description = "Compares stored balances against a replay of the general ledger")
    public ResponseEntity<ApiResponse<BalanceVerificationResponse>> verifyBalances() {
        BalanceVerificationResponse verification = balanceAggregator.verifyBalances();
        if (!verification.isConsistent()) {
            log.error("Balance verification found {} mismatches", verification.getMismatches().size());
        }
        return ApiResponse.success(verification).toResponseEntity();
    }

    @GetMapping("/balances/{code}")
    @Operation(summary = "Get account balance",
               description = "Balance of the account and its descendants, current or as of a date")
    public ResponseEntity<ApiResponse<AccountBalanceResponse>> getBalance(
            @PathVariable String code,
            @Parameter(description = "As of date (YYYY-MM-DD), inclusive")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        AccountBalanceResponse balance = asOf == null
            ? balanceAggregator.currentBalance(code)
            : balanceAggregator.balanceAsOf(code, asOf);
        return ApiResponse.success(balance).toResponseEntity();
    }

    @GetMapping("/reports/trial-balance")
    @Operation(summary = "Generate trial balance",
               description = "Generates trial balance for an accounting period")
    public ResponseEntity<ApiResponse<TrialBalanceResponse>> getTrialBalance(
            @Parameter(description = "Accounting period ID")
            @RequestParam UUID periodId) {

        log.info("Generating trial balance for period: {}", periodId);
        return ApiResponse.success(balanceAggregator.trialBalance(periodId)).toResponseEntity();
    }
}
