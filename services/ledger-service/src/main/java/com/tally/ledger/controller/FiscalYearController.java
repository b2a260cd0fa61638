package com.tally.ledger.controller;

import com.tally.common.api.ApiResponse;
import com.tally.ledger.domain.AccountingPeriod;
import com.tally.ledger.dto.request.CreateFiscalYearRequest;
import com.tally.ledger.dto.response.FiscalYearCloseResponse;
import com.tally.ledger.dto.response.FiscalYearResponse;
import com.tally.ledger.dto.response.PeriodResponse;
import com.tally.ledger.dto.response.PostingStatusResponse;
import com.tally.ledger.mapper.LedgerMapper;
import com.tally.ledger.service.FiscalYearCloseService;
import com.tally.ledger.service.PeriodRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Fiscal years, their periods, and the period close/lock lifecycle
 */
@RestController
@RequestMapping("/api/v1/accounting")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Periods", description = "Fiscal years and accounting periods")
public class FiscalYearController {

    private final PeriodRegistryService periodRegistryService;
    private final FiscalYearCloseService fiscalYearCloseService;
    private final LedgerMapper mapper;

    @PostMapping("/fiscal-years")
    @Operation(summary = "Create fiscal year",
               description = "Creates a fiscal year with monthly periods unless an explicit partition is supplied")
    public ResponseEntity<ApiResponse<FiscalYearResponse>> createFiscalYear(
            @Valid @RequestBody CreateFiscalYearRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        log.info("Creating fiscal year {} [{}, {})", request.getName(), request.getStartDate(), request.getEndDate());
        return ApiResponse.created(mapper.toResponse(periodRegistryService.createFiscalYear(request, actor)))
            .toResponseEntity();
    }

    @GetMapping("/fiscal-years")
    @Operation(summary = "List fiscal years")
    public ResponseEntity<ApiResponse<List<FiscalYearResponse>>> listFiscalYears() {
        List<FiscalYearResponse> years = periodRegistryService.listFiscalYears().stream()
            .map(mapper::toResponse)
            .collect(Collectors.toList());
        return ApiResponse.success(years).toResponseEntity();
    }

    @GetMapping("/fiscal-years/{id}")
    @Operation(summary = "Get fiscal year")
    public ResponseEntity<ApiResponse<FiscalYearResponse>> getFiscalYear(@PathVariable UUID id) {
        return ApiResponse.success(mapper.toResponse(periodRegistryService.getFiscalYear(id)))
            .toResponseEntity();
    }

    @PostMapping("/fiscal-years/{id}/close")
    @Operation(summary = "Close fiscal year",
               description = "Transfers revenue and expense balances to retained earnings and closes the year")
    public ResponseEntity<ApiResponse<FiscalYearCloseResponse>> closeFiscalYear(
            @PathVariable UUID id,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        log.info("Closing fiscal year {}", id);
        return ApiResponse.success(mapper.toResponse(fiscalYearCloseService.closeFiscalYear(id, actor)),
                "Fiscal year closed")
            .toResponseEntity();
    }

    @PostMapping("/periods/{id}/close")
    @Operation(summary = "Close period", description = "Periods close in order and only without pending entries")
    public ResponseEntity<ApiResponse<PeriodResponse>> closePeriod(
            @PathVariable UUID id,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.success(mapper.toResponse(periodRegistryService.closePeriod(id, actor)), "Period closed")
            .toResponseEntity();
    }

    @PostMapping("/periods/{id}/lock")
    @Operation(summary = "Lock period", description = "Blocks all postings, including closing entries")
    public ResponseEntity<ApiResponse<PeriodResponse>> lockPeriod(
            @PathVariable UUID id,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.success(mapper.toResponse(periodRegistryService.lockPeriod(id, actor)), "Period locked")
            .toResponseEntity();
    }

    @PostMapping("/periods/{id}/unlock")
    @Operation(summary = "Unlock period")
    public ResponseEntity<ApiResponse<PeriodResponse>> unlockPeriod(
            @PathVariable UUID id,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.success(mapper.toResponse(periodRegistryService.unlockPeriod(id, actor)), "Period unlocked")
            .toResponseEntity();
    }

    @GetMapping("/periods/open")
    @Operation(summary = "Check whether a date accepts postings")
    public ResponseEntity<ApiResponse<PostingStatusResponse>> isOpenForPosting(
            @Parameter(description = "Posting date (YYYY-MM-DD)")
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        Optional<AccountingPeriod> period = periodRegistryService.findPeriodForDate(date);
        PostingStatusResponse status = PostingStatusResponse.builder()
            .date(date)
            .open(periodRegistryService.isOpenForPosting(date))
            .periodId(period.map(AccountingPeriod::getId).orElse(null))
            .periodName(period.map(AccountingPeriod::getName).orElse(null))
            .build();
        return ApiResponse.success(status).toResponseEntity();
    }
}
