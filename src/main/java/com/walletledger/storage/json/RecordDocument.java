package com.walletledger.storage.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A record or a mandatory expense template as stored in the JSON document.
 * {@code amount} only appears in legacy documents and is never written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecordDocument {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("type")
    private String type;

    @JsonProperty("date")
    private String date;

    @JsonProperty("wallet_id")
    private Long walletId;

    @JsonProperty("transfer_id")
    private Long transferId;

    @JsonProperty("commission_for_transfer_id")
    private Long commissionForTransferId;

    @JsonProperty("amount_original")
    private Double amountOriginal;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("rate_at_operation")
    private Double rateAtOperation;

    @JsonProperty("amount_kzt")
    private Double amountKzt;

    @JsonProperty("amount")
    private Double amount;

    @JsonProperty("category")
    private String category;

    @JsonProperty("description")
    private String description;

    @JsonProperty("period")
    private String period;
}
