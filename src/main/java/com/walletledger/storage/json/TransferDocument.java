package com.walletledger.storage.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransferDocument {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("from_wallet_id")
    private Long fromWalletId;

    @JsonProperty("to_wallet_id")
    private Long toWalletId;

    @JsonProperty("date")
    private String date;

    @JsonProperty("amount_original")
    private Double amountOriginal;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("rate_at_operation")
    private Double rateAtOperation;

    @JsonProperty("amount_kzt")
    private Double amountKzt;

    @JsonProperty("description")
    private String description;
}
