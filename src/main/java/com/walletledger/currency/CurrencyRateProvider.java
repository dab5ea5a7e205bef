package com.walletledger.currency;

/**
 * Source of exchange rates against the base currency.
 *
 * Only a static, configuration-backed implementation ships with the ledger. A provider
 * fetching live rates can be plugged in by registering another bean.
 */
public interface CurrencyRateProvider {

    /**
     * @return the currency {@code amount_kzt} values are expressed in
     */
    String getBaseCurrency();

    /**
     * Get the rate of one unit of {@code currency} in the base currency.
     *
     * @param currency three letter currency code
     * @return rate, {@code 1.0} for the base currency
     * @throws com.walletledger.common.exception.UnsupportedCurrencyException when the currency is unknown
     */
    double getRate(String currency);

    /**
     * Convert an amount to the base currency.
     *
     * @param amount amount in {@code currency}
     * @param currency three letter currency code
     * @return converted amount, rounded to cents
     */
    double convert(double amount, String currency);
}
