package com.flagship.vn_accounting.money;

import com.flagship.vn_accounting.money.dto.ConvertRequest;
import com.flagship.vn_accounting.money.dto.ExchangeDifferenceRequest;
import com.flagship.vn_accounting.money.dto.ExchangeDifferenceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Foreign-currency conversion (Article 31). Rates are supplied by the caller.
 */
@RestController
@RequestMapping("/api/v1/exchange-rates")
@RequiredArgsConstructor
public class ExchangeRateController {

    private final ExchangeRateService exchangeRateService;

    @PostMapping("/convert")
    public Map<String, Object> convert(@Valid @RequestBody ConvertRequest request) {
        ExchangeRate rate = new ExchangeRate(request.getRate(), request.getCurrency(),
                request.getRateType(), request.getValuationDate());
        Money vnd = exchangeRateService.convertToVnd(Money.of(request.getAmount(), request.getCurrency()), rate);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("amount", request.getAmount());
        response.put("currency", request.getCurrency());
        response.put("rate", request.getRate());
        response.put("rate_type", rate.getRateType());
        response.put("vnd_amount", vnd.getAmount());
        return response;
    }

    @PostMapping("/difference")
    public ExchangeDifferenceResponse difference(@Valid @RequestBody ExchangeDifferenceRequest request) {
        Money difference = exchangeRateService.calculateExchangeDifference(
            ExchangeRate.realtime(request.getOriginalRate(), request.getCurrency()),
            ExchangeRate.realtime(request.getCurrentRate(), request.getCurrency()),
            request.getAmount());
        return ExchangeDifferenceResponse.from(exchangeRateService.classifyExchangeDifference(difference));
    }
}
