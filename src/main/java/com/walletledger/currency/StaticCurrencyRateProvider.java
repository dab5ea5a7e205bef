package com.walletledger.currency;

import com.walletledger.common.Amounts;
import com.walletledger.common.CurrencyCodes;
import com.walletledger.common.exception.UnsupportedCurrencyException;
import com.walletledger.config.LedgerStoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Rate provider backed by the {@code ledger.currency.rates} configuration.
 */
@Component
@Slf4j
public class StaticCurrencyRateProvider implements CurrencyRateProvider {

    private final String baseCurrency;
    private final Map<String, Double> rates = new HashMap<>();

    @Autowired
    public StaticCurrencyRateProvider(LedgerStoreProperties properties) {
        this(properties.getCurrency().getBase(), properties.getCurrency().getRates());
    }

    public StaticCurrencyRateProvider(String baseCurrency, Map<String, Double> configuredRates) {
        this.baseCurrency = CurrencyCodes.normalize(baseCurrency);
        configuredRates.forEach((code, rate) -> rates.put(CurrencyCodes.normalize(code), rate));
        rates.put(this.baseCurrency, 1.0);
        log.debug("Loaded {} currency rates against {}", rates.size(), this.baseCurrency);
    }

    @Override
    public String getBaseCurrency() {
        return baseCurrency;
    }

    @Override
    public double getRate(String currency) {
        String code = CurrencyCodes.normalize(currency);
        Double rate = rates.get(code);
        if (rate == null) {
            throw new UnsupportedCurrencyException(code);
        }
        return rate;
    }

    @Override
    public double convert(double amount, String currency) {
        return Amounts.round2(amount * getRate(currency));
    }
}
