package com.walletledger.storage.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the JSON document in its current shape.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerDocument {

    @JsonProperty("wallets")
    private List<WalletDocument> wallets = new ArrayList<>();

    @JsonProperty("records")
    private List<RecordDocument> records = new ArrayList<>();

    @JsonProperty("mandatory_expenses")
    private List<RecordDocument> mandatoryExpenses = new ArrayList<>();

    @JsonProperty("transfers")
    private List<TransferDocument> transfers = new ArrayList<>();
}
