package com.flagship.vn_accounting.account;

import com.flagship.vn_accounting.account.dto.AccountResponse;
import com.flagship.vn_accounting.account.dto.CreateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Chart of accounts (Appendix II).
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;

    @GetMapping
    public List<AccountResponse> listAccounts(@RequestParam(value = "type", required = false) AccountType type) {
        return accountService.listAccounts(type).stream().map(AccountResponse::from).toList();
    }

    @GetMapping("/{code}")
    public AccountResponse getAccount(@PathVariable("code") String code) {
        return AccountResponse.from(accountService.getAccount(code));
    }

    /**
     * Wildcard lookup, e.g. {@code ?pattern=156*}.
     */
    @GetMapping("/search")
    public List<AccountResponse> search(@RequestParam("pattern") String pattern) {
        return accountService.findByPattern(pattern).stream().map(AccountResponse::from).toList();
    }

    @GetMapping("/negative-balances")
    public Map<String, Object> negativeBalances() {
        List<String> warnings = accountService.checkNegativeBalances();
        return Map.of("count", warnings.size(), "warnings", warnings);
    }

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(
            @Valid @RequestBody CreateAccountRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String userId) {
        log.info("Received account creation request: code={}, type={}", request.getCode(), request.getAccountType());
        Account account = accountService.createAccount(
            request.getCode(),
            request.getName(),
            request.getAccountType(),
            request.getParentCode(),
            request.isDetail(),
            request.getBalanceDirection(),
            request.getOpeningBalanceDebit(),
            request.getOpeningBalanceCredit(),
            userId
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }
}
