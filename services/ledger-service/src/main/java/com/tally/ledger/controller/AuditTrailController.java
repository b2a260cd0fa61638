package com.tally.ledger.controller;

import com.tally.common.api.ApiResponse;
import com.tally.ledger.dto.response.AuditTrailResponse;
import com.tally.ledger.mapper.LedgerMapper;
import com.tally.ledger.service.AuditTrailService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/accounting/audit")
@RequiredArgsConstructor
@Tag(name = "Audit Trail", description = "Recorded ledger changes")
public class AuditTrailController {

    private final AuditTrailService auditTrailService;
    private final LedgerMapper mapper;

    @GetMapping
    @Operation(summary = "History of a ledger object", description = "Audit rows oldest first")
    public ResponseEntity<ApiResponse<List<AuditTrailResponse>>> history(
            @Parameter(description = "ACCOUNT, JOURNAL, JOURNAL_ENTRY, FISCAL_YEAR or PERIOD")
            @RequestParam String entityType,
            @RequestParam String entityId) {

        List<AuditTrailResponse> trail = auditTrailService.history(entityType, entityId).stream()
            .map(mapper::toResponse)
            .collect(Collectors.toList());
        return ApiResponse.success(trail).toResponseEntity();
    }
}
