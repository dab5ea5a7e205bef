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
public class WalletDocument {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("initial_balance")
    private Double initialBalance;

    @JsonProperty("system")
    private Boolean system;

    @JsonProperty("allow_negative")
    private Boolean allowNegative;

    @JsonProperty("is_active")
    private Boolean active;
}
