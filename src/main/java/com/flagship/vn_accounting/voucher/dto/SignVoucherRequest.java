package com.flagship.vn_accounting.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Both fields are optional: the signer defaults to the caller and the
 * signature to a generated marker.
 */
@Value
public class SignVoucherRequest {

    @JsonProperty("signer_id")
    String signerId;

    @JsonProperty("signature_data")
    String signatureData;
}
