package com.tally.ledger.controller;

import com.tally.common.api.ApiResponse;
import com.tally.ledger.domain.AccountType;
import com.tally.ledger.dto.request.CreateAccountRequest;
import com.tally.ledger.dto.request.UpdateAccountRequest;
import com.tally.ledger.dto.response.AccountResponse;
import com.tally.ledger.mapper.LedgerMapper;
import com.tally.ledger.service.ChartOfAccountsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Chart of accounts maintenance
 */
@RestController
@RequestMapping("/api/v1/accounting/accounts")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Chart of Accounts", description = "Account creation, hierarchy and activation")
public class AccountController {

    private final ChartOfAccountsService chartOfAccountsService;
    private final LedgerMapper mapper;

    @PostMapping
    @Operation(summary = "Create account",
               description = "Adds an account to the chart, optionally under a parent and with an opening balance")
    public ResponseEntity<ApiResponse<AccountResponse>> createAccount(
            @Valid @RequestBody CreateAccountRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        log.info("Creating account: code={}, type={}", request.getCode(), request.getType());

        return ApiResponse.created(mapper.toResponse(chartOfAccountsService.createAccount(request, actor)))
            .toResponseEntity();
    }

    @GetMapping("/{code}")
    @Operation(summary = "Get account")
    public ResponseEntity<ApiResponse<AccountResponse>> getAccount(@PathVariable String code) {
        return ApiResponse.success(mapper.toResponse(chartOfAccountsService.getAccount(code)))
            .toResponseEntity();
    }

    @GetMapping
    @Operation(summary = "List accounts", description = "Lists accounts ordered by code, optionally filtered")
    public ResponseEntity<ApiResponse<List<AccountResponse>>> listAccounts(
            @Parameter(description = "Account type filter") @RequestParam(required = false) AccountType type,
            @Parameter(description = "Direct parent filter") @RequestParam(required = false) String parentCode,
            @Parameter(description = "Active flag filter") @RequestParam(required = false) Boolean active) {

        return ApiResponse.success(mapper.toAccountResponses(
                chartOfAccountsService.listAccounts(type, parentCode, active)))
            .toResponseEntity();
    }

    @GetMapping("/{code}/children")
    @Operation(summary = "List direct children")
    public ResponseEntity<ApiResponse<List<AccountResponse>>> listChildren(@PathVariable String code) {
        return ApiResponse.success(mapper.toAccountResponses(chartOfAccountsService.listChildren(code)))
            .toResponseEntity();
    }

    @GetMapping("/{code}/ancestors")
    @Operation(summary = "List ancestors", description = "Root first, excluding the account itself")
    public ResponseEntity<ApiResponse<List<AccountResponse>>> listAncestors(@PathVariable String code) {
        return ApiResponse.success(mapper.toAccountResponses(chartOfAccountsService.ancestorsOf(code)))
            .toResponseEntity();
    }

    @PatchMapping("/{code}")
    @Operation(summary = "Update account description fields")
    public ResponseEntity<ApiResponse<AccountResponse>> updateAccount(
            @PathVariable String code,
            @Valid @RequestBody UpdateAccountRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.success(mapper.toResponse(chartOfAccountsService.updateAccount(code, request, actor)))
            .toResponseEntity();
    }

    @PostMapping("/{code}/deactivate")
    @Operation(summary = "Deactivate account", description = "Rejected while the account has active children")
    public ResponseEntity<ApiResponse<AccountResponse>> deactivate(
            @PathVariable String code,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        log.info("Deactivating account {}", code);
        return ApiResponse.success(mapper.toResponse(chartOfAccountsService.deactivate(code, actor)),
                "Account deactivated")
            .toResponseEntity();
    }

    @PostMapping("/{code}/reactivate")
    @Operation(summary = "Reactivate account")
    public ResponseEntity<ApiResponse<AccountResponse>> reactivate(
            @PathVariable String code,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        log.info("Reactivating account {}", code);
        return ApiResponse.success(mapper.toResponse(chartOfAccountsService.reactivate(code, actor)),
                "Account reactivated")
            .toResponseEntity();
    }
}
