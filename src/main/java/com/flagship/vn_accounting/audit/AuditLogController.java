package com.flagship.vn_accounting.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only access to the audit trail.
 */
@RestController
@RequestMapping("/api/v1/audit-logs")
@RequiredArgsConstructor
@Validated
public class AuditLogController {

    private final AuditService auditService;

    @GetMapping
    public AuditPage search(
            @RequestParam(value = "entity_type", required = false) String entityType,
            @RequestParam(value = "entity_id", required = false) UUID entityId,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "action", required = false) AuditAction action,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "50") @Min(1) @Max(500) int size) {

        AuditQuery query = AuditQuery.builder()
                .entityType(entityType)
                .entityId(entityId)
                .userId(userId)
                .action(action)
                .from(from)
                .to(to)
                .build();
        Page<AuditLog> result = auditService.search(query, page, size);
        return AuditPage.builder()
                .items(result.getContent())
                .page(result.getNumber())
                .size(result.getSize())
                .totalElements(result.getTotalElements())
                .build();
    }

    @lombok.Value
    @Builder
    public static class AuditPage {
        @JsonProperty("items")
        List<AuditLog> items;
        @JsonProperty("page")
        int page;
        @JsonProperty("size")
        int size;
        @JsonProperty("total_elements")
        long totalElements;
    }
}
