package com.flagship.vn_accounting.period;

import com.flagship.vn_accounting.period.dto.FiscalPeriodResponse;
import com.flagship.vn_accounting.period.dto.LockPeriodRequest;
import com.flagship.vn_accounting.period.dto.PeriodLockResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/periods")
@RequiredArgsConstructor
@Slf4j
public class FiscalPeriodController {

    private final PeriodLockService periodLockService;
    private final FiscalPeriodService fiscalPeriodService;

    @PostMapping("/lock")
    public PeriodLockResponse lockPeriod(
            @Valid @RequestBody LockPeriodRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String userId) {
        if (request.getPeriodType() != PeriodType.YEAR && request.getPeriodValue() == null) {
            throw new IllegalArgumentException("period_value is required for " + request.getPeriodType());
        }
        log.info("Received period lock request: type={}, year={}, value={}",
                request.getPeriodType(), request.getYear(), request.getPeriodValue());
        int value = request.getPeriodValue() != null ? request.getPeriodValue() : request.getYear();
        return PeriodLockResponse.from(
            periodLockService.lockPeriod(request.getPeriodType(), request.getYear(), value, userId));
    }

    @GetMapping
    public List<FiscalPeriodResponse> listPeriods(@RequestParam("year") int year) {
        return fiscalPeriodService.listPeriods(year).stream().map(FiscalPeriodResponse::from).toList();
    }

    @GetMapping("/status")
    public Map<String, Object> periodStatus(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("date", date.toString());
        response.put("is_open", fiscalPeriodService.isPeriodOpen(date));
        return response;
    }
}
