package com.flagship.vn_accounting.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vn_accounting.account.dto.AccountResponse;
import com.flagship.vn_accounting.journal.PostingResult;
import lombok.Value;

import java.util.List;

@Value
public class PostingResponse {

    @JsonProperty("entry")
    JournalEntryResponse entry;

    @JsonProperty("accounts")
    List<AccountResponse> accounts;

    @JsonProperty("warnings")
    List<String> warnings;

    public static PostingResponse from(PostingResult result) {
        return new PostingResponse(
            JournalEntryResponse.from(result.getEntry()),
            result.getAccounts().stream().map(AccountResponse::from).toList(),
            result.getWarnings()
        );
    }
}
