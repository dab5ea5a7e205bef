package com.walletledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Main application class for the Wallet Ledger.
 *
 * The ledger keeps wallets, income and expense records and transfers between wallets for a
 * single user. Data lives in SQLite, with a JSON document kept as a mirror and migration source.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class WalletLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WalletLedgerApplication.class, args);
    }
}
