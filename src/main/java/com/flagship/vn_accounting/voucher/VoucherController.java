package com.flagship.vn_accounting.voucher;

import com.flagship.vn_accounting.journal.JournalPostingService;
import com.flagship.vn_accounting.journal.PostingResult;
import com.flagship.vn_accounting.journal.dto.JournalEntryResponse;
import com.flagship.vn_accounting.observability.AccountingMetrics;
import com.flagship.vn_accounting.observability.CorrelationContext;
import com.flagship.vn_accounting.voucher.dto.BalanceCheckResponse;
import com.flagship.vn_accounting.voucher.dto.CreateVoucherRequest;
import com.flagship.vn_accounting.voucher.dto.SignVoucherRequest;
import com.flagship.vn_accounting.voucher.dto.VoucherLineRequest;
import com.flagship.vn_accounting.voucher.dto.VoucherResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
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
 * Voucher entry (Articles 8-9).
 *
 * Creation requires an Idempotency-Key header: repeating a request with the
 * same key returns the voucher created the first time (200 instead of 201).
 */
@RestController
@RequestMapping("/api/v1/vouchers")
@RequiredArgsConstructor
@Validated
@Slf4j
public class VoucherController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String USER_HEADER = "X-User-Id";

    private final VoucherService voucherService;
    private final JournalPostingService journalPostingService;
    private final AccountingMetrics metrics;

    @PostMapping
    public ResponseEntity<VoucherResponse> createVoucher(
            @Valid @RequestBody CreateVoucherRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {

        long startTime = System.currentTimeMillis();
        log.info("Received voucher creation request: idempotencyKey={}, type={}, date={}, lines={}",
                idempotencyKey, request.getVoucherType(), request.getVoucherDate(), request.getLines().size());

        try {
            VoucherDraft draft = VoucherDraft.builder()
                    .voucherType(request.getVoucherType())
                    .voucherDate(request.getVoucherDate())
                    .postingDate(request.getPostingDate())
                    .description(request.getDescription())
                    .descriptionDetail(request.getDescriptionDetail())
                    .documentRef(request.getDocumentRef())
                    .documentDate(request.getDocumentDate())
                    .branchCode(request.getBranchCode())
                    .lines(request.getLines().stream().map(VoucherLineRequest::toDomain).toList())
                    .build();

            VoucherCreation creation = voucherService.createVoucher(draft, idempotencyKey, userId);
            MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, creation.getVoucher().getId().toString());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLatency("create_voucher", duration);
            log.info("Voucher {} {} in {}ms", creation.getVoucher().getVoucherNumber(),
                    creation.isReplayed() ? "replayed" : "created", duration);

            HttpStatus status = creation.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
            return ResponseEntity.status(status).body(VoucherResponse.from(creation.getVoucher()));
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLatency("create_voucher", duration);
            log.error("Voucher creation failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    @GetMapping("/{id}")
    public VoucherResponse getVoucher(@PathVariable("id") UUID id) {
        return VoucherResponse.from(voucherService.getVoucher(id));
    }

    @GetMapping
    public List<VoucherResponse> listVouchers(
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "voucher_type", required = false) String voucherType,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "50") @Min(1) @Max(500) int size) {
        VoucherType type = voucherType != null ? VoucherType.fromCode(voucherType) : null;
        return voucherService.listVouchers(startDate, endDate, type, page, size)
                .stream()
                .map(VoucherResponse::from)
                .toList();
    }

    @PostMapping("/{id}/sign")
    public VoucherResponse signVoucher(
            @PathVariable("id") UUID id,
            @RequestBody(required = false) SignVoucherRequest request,
            @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, id.toString());
        try {
            String signerId = request != null ? request.getSignerId() : null;
            String signature = request != null ? request.getSignatureData() : null;
            return VoucherResponse.from(voucherService.signVoucher(id, signerId, signature, userId));
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    @PostMapping("/{id}/lock")
    public VoucherResponse lockVoucher(
            @PathVariable("id") UUID id,
            @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, id.toString());
        try {
            return VoucherResponse.from(voucherService.lockVoucher(id, userId));
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    /**
     * Posts every unposted journal entry of the voucher.
     */
    @PostMapping("/{id}/post")
    public List<JournalEntryResponse> postVoucher(
            @PathVariable("id") UUID id,
            @RequestHeader(value = USER_HEADER, defaultValue = "system") String userId) {
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, id.toString());
        try {
            return journalPostingService.postVoucherEntries(id, userId)
                    .stream()
                    .map(PostingResult::getEntry)
                    .map(JournalEntryResponse::from)
                    .toList();
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    @GetMapping("/{id}/balance-check")
    public BalanceCheckResponse checkBalance(@PathVariable("id") UUID id) {
        return BalanceCheckResponse.from(voucherService.checkBalance(id));
    }

    @GetMapping("/{id}/journal-entries")
    public List<JournalEntryResponse> getJournalEntries(@PathVariable("id") UUID id) {
        voucherService.getVoucher(id);
        return voucherService.getJournalEntries(id)
                .stream()
                .map(JournalEntryResponse::from)
                .toList();
    }
}
