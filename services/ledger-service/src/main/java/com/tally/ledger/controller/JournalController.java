package com.tally.ledger.controller;

import com.tally.common.api.ApiResponse;
import com.tally.ledger.dto.request.CreateJournalRequest;
import com.tally.ledger.dto.response.JournalResponse;
import com.tally.ledger.mapper.LedgerMapper;
import com.tally.ledger.service.JournalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/accounting/journals")
@RequiredArgsConstructor
@Tag(name = "Journals", description = "Journals and their entry-number sequences")
public class JournalController {

    private final JournalService journalService;
    private final LedgerMapper mapper;

    @PostMapping
    @Operation(summary = "Create journal")
    public ResponseEntity<ApiResponse<JournalResponse>> createJournal(
            @Valid @RequestBody CreateJournalRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String actor) {

        return ApiResponse.created(mapper.toResponse(journalService.createJournal(request, actor)))
            .toResponseEntity();
    }

    @GetMapping
    @Operation(summary = "List journals")
    public ResponseEntity<ApiResponse<List<JournalResponse>>> listJournals() {
        List<JournalResponse> journals = journalService.listJournals().stream()
            .map(mapper::toResponse)
            .collect(Collectors.toList());
        return ApiResponse.success(journals).toResponseEntity();
    }

    @GetMapping("/{code}")
    @Operation(summary = "Get journal")
    public ResponseEntity<ApiResponse<JournalResponse>> getJournal(@PathVariable String code) {
        return ApiResponse.success(mapper.toResponse(journalService.getJournal(code))).toResponseEntity();
    }
}
