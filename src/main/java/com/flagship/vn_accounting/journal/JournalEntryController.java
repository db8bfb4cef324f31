package com.flagship.vn_accounting.journal;

import com.flagship.vn_accounting.journal.dto.JournalEntryResponse;
import com.flagship.vn_accounting.journal.dto.PostingResponse;
import com.flagship.vn_accounting.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/journal-entries")
@RequiredArgsConstructor
@Slf4j
public class JournalEntryController {

    private static final String USER_HEADER = "X-User-Id";

    private final JournalPostingService journalPostingService;

    @GetMapping("/{id}")
    public JournalEntryResponse getEntry(@PathVariable("id") UUID id) {
        return JournalEntryResponse.from(journalPostingService.getEntry(id));
    }

    /**
     * Entries dated in a range, or touching one account when {@code account_code} is given.
     */
    @GetMapping
    public List<JournalEntryResponse> findEntries(
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "account_code", required = false) String accountCode) {
        List<JournalEntry> entries;
        if (accountCode != null) {
            entries = journalPostingService.findByAccountCode(accountCode);
        } else if (startDate != null && endDate != null) {
            entries = journalPostingService.findByPeriod(startDate, endDate);
        } else {
            throw new IllegalArgumentException("Either account_code or both start_date and end_date are required");
        }
        return entries.stream().map(JournalEntryResponse::from).toList();
    }

    @PostMapping("/{id}/post")
    public PostingResponse postEntry(
            @PathVariable("id") UUID id,
            @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, id.toString());
        try {
            log.info("Received posting request for entry {}", id);
            return PostingResponse.from(journalPostingService.postEntry(id, userId));
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    @PostMapping("/{id}/lock")
    public JournalEntryResponse lockEntry(
            @PathVariable("id") UUID id,
            @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, id.toString());
        try {
            return JournalEntryResponse.from(journalPostingService.lockEntry(id, userId));
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }
}
