package com.flagship.vn_accounting.provision;

import com.flagship.vn_accounting.money.Money;
import com.flagship.vn_accounting.provision.dto.ProvisionResponse;
import com.flagship.vn_accounting.provision.dto.SpecificProvisionRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/provisions")
@RequiredArgsConstructor
@Validated
public class ProvisionController {

    private final ProvisionService provisionService;

    @PostMapping("/specific")
    public ProvisionResponse specificProvision(@Valid @RequestBody SpecificProvisionRequest request) {
        return ProvisionResponse.from(provisionService.calculateSpecificProvision(
            request.getReceivables().stream().map(SpecificProvisionRequest.Receivable::toDomain).toList()));
    }

    @GetMapping("/general")
    public Map<String, BigDecimal> generalProvision(
            @RequestParam("total_receivables") @DecimalMin("0") BigDecimal totalReceivables) {
        Money provision = provisionService.calculateGeneralProvision(Money.vnd(totalReceivables));
        return Map.of("total_receivables", totalReceivables, "provision", provision.getAmount());
    }
}
