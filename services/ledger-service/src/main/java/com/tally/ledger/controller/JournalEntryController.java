package com.tally.ledger.controller;

import com.tally.common.api.ApiResponse;
import com.tally.ledger.domain.JournalStatus;
import com.tally.ledger.dto.request.CreateDraftRequest;
import com.tally.ledger.dto.request.CreateJournalEntryRequest;
import com.tally.ledger.dto.request.JournalLineRequest;
import com.tally.ledger.dto.request.ReverseEntryRequest;
import com.tally.ledger.dto.response.JournalEntryResponse;
import com.tally.ledger.mapper.LedgerMapper;
import com.tally.ledger.service.JournalEntryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
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
import java.util.UUID;

/**
 * Journal entry lifecycle: draft, lines, validate, post, reverse, archive
 */
@RestController
@RequestMapping("/api/v1/accounting/journal-entries")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Journal Entries", description = "Double-entry journal entries")
public class JournalEntryController {

    private final JournalEntryService journalEntryService;
    private final LedgerMapper mapper;

    @PostMapping
    @Operation(summary = "Create and post journal entry",
               description = "Creates, validates and posts an entry in a single transaction")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> createAndPost(
            @Valid @RequestBody CreateJournalEntryRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        log.info("Posting journal entry dated {} with {} lines", request.getEntryDate(), request.getLines().size());
        return ApiResponse.created(mapper.toResponse(journalEntryService.createAndPost(request, actor)))
            .toResponseEntity();
    }

    @PostMapping("/drafts")
    @Operation(summary = "Create draft entry")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> createDraft(
            @Valid @RequestBody CreateDraftRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.created(mapper.toResponse(journalEntryService.createDraft(request, actor)))
            .toResponseEntity();
    }

    @PostMapping("/{id}/lines")
    @Operation(summary = "Add line to draft")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> addLine(
            @PathVariable UUID id,
            @Valid @RequestBody JournalLineRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.success(mapper.toResponse(journalEntryService.addLine(id, request, actor)))
            .toResponseEntity();
    }

    @DeleteMapping("/{id}/lines/{lineNumber}")
    @Operation(summary = "Remove line from draft")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> removeLine(
            @PathVariable UUID id,
            @PathVariable int lineNumber,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.success(mapper.toResponse(journalEntryService.removeLine(id, lineNumber, actor)))
            .toResponseEntity();
    }

    @PostMapping("/{id}/validate")
    @Operation(summary = "Validate balance", description = "Moves a draft to BALANCED when debits equal credits")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> validate(
            @PathVariable UUID id,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.success(mapper.toResponse(journalEntryService.validateBalance(id, actor)))
            .toResponseEntity();
    }

    @PostMapping("/{id}/post")
    @Operation(summary = "Post balanced entry")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> post(
            @PathVariable UUID id,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        log.info("Posting journal entry {}", id);
        return ApiResponse.success(mapper.toResponse(journalEntryService.post(id, actor)), "Journal entry posted")
            .toResponseEntity();
    }

    @PostMapping("/{id}/reverse")
    @Operation(summary = "Reverse posted entry",
               description = "Posts a mirror entry; the original is reported as REVERSED")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> reverse(
            @PathVariable UUID id,
            @RequestBody(required = false) ReverseEntryRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        log.info("Reversing journal entry {}", id);
        ReverseEntryRequest effective = request == null ? new ReverseEntryRequest() : request;
        return ApiResponse.created(mapper.toResponse(journalEntryService.reverse(id, effective, actor)))
            .toResponseEntity();
    }

    @PostMapping("/{id}/archive")
    @Operation(summary = "Archive posted entry", description = "Only entries of closed periods can be archived")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> archive(
            @PathVariable UUID id,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.success(mapper.toResponse(journalEntryService.archive(id, actor)))
            .toResponseEntity();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get journal entry")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> getEntry(@PathVariable UUID id) {
        return ApiResponse.success(mapper.toResponse(journalEntryService.getEntry(id)))
            .toResponseEntity();
    }

    @GetMapping("/by-number/{entryNumber}")
    @Operation(summary = "Get journal entry by number")
    public ResponseEntity<ApiResponse<JournalEntryResponse>> getEntryByNumber(@PathVariable String entryNumber) {
        return ApiResponse.success(mapper.toResponse(journalEntryService.getEntryByNumber(entryNumber)))
            .toResponseEntity();
    }

    @GetMapping
    @Operation(summary = "List journal entries")
    public ResponseEntity<ApiResponse<List<JournalEntryResponse>>> listEntries(
            @Parameter(description = "Reported status") @RequestParam(required = false) JournalStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) String journalCode) {

        return ApiResponse.success(mapper.toEntryResponses(
                journalEntryService.listEntries(status, from, to, journalCode)))
            .toResponseEntity();
    }
}
