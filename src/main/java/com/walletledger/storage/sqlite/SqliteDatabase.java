package com.walletledger.storage.sqlite;

import com.walletledger.common.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One SQLite file opened over a single JDBC connection.
 *
 * Foreign keys are enforced and the journal runs in WAL mode. All work goes through
 * {@link #jdbc()} and {@link #inTransaction(TransactionCallback)} on that connection.
 */
@Slf4j
public class SqliteDatabase implements AutoCloseable {

    public static final String BUNDLED_SCHEMA = "db/schema.sql";

    static final List<String> TABLES = List.of("wallets", "transfers", "records", "mandatory_expenses");

    private final Path path;
    private final SingleConnectionDataSource dataSource;
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    private SqliteDatabase(Path path) {
        this.path = path;
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);

        this.dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + path.toAbsolutePath(), true);
        this.dataSource.setDriverClassName("org.sqlite.JDBC");
        this.dataSource.setConnectionProperties(config.toProperties());
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Open (creating if needed) the database file and apply the schema.
     *
     * @param schema schema script, or {@code null} for the bundled one
     */
    public static SqliteDatabase open(Path path, Resource schema) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot create directory for " + path, e);
        }
        SqliteDatabase database = new SqliteDatabase(path);
        try {
            database.applySchema(schema == null ? bundledSchema() : schema);
        } catch (RuntimeException e) {
            database.close();
            throw e;
        }
        return database;
    }

    public static Resource bundledSchema() {
        return new ClassPathResource(BUNDLED_SCHEMA);
    }

    /**
     * Resolve a configured schema location, falling back to the bundled script.
     */
    public static Resource schemaResource(String schemaPath) {
        return schemaPath == null || schemaPath.isBlank()
            ? bundledSchema() : new FileSystemResource(schemaPath);
    }

    public void applySchema(Resource schema) {
        if (!schema.exists()) {
            throw new StorageException("Schema file not found: " + schema.getDescription());
        }
        try {
            new ResourceDatabasePopulator(schema).execute(dataSource);
        } catch (DataAccessException e) {
            throw new StorageException("Cannot apply schema to " + path + ": " + e.getMessage(), e);
        }
        log.debug("Applied schema {} to {}", schema.getDescription(), path);
    }

    public NamedParameterJdbcTemplate jdbc() {
        return jdbc;
    }

    public <T> T inTransaction(TransactionCallback<T> action) {
        return transactionTemplate.execute(action);
    }

    public void inTransaction(Runnable action) {
        transactionTemplate.executeWithoutResult(status -> action.run());
    }

    public boolean ping() {
        Integer one = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return one != null && one == 1;
    }

    /**
     * Row count per ledger table.
     */
    public Map<String, Integer> countRows() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String table : TABLES) {
            Integer count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
            counts.put(table, count == null ? 0 : count);
        }
        return counts;
    }

    /**
     * Balance of every wallet derived in SQL from its initial balance and records, keyed by wallet id.
     */
    public Map<Long, Double> walletBalances() {
        String sql = """
            SELECT w.id AS wallet_id,
                   w.initial_balance + COALESCE(SUM(
                       CASE WHEN r.type = 'income' THEN r.amount_kzt ELSE -ABS(r.amount_kzt) END), 0) AS balance
            FROM wallets w
            LEFT JOIN records r ON r.wallet_id = w.id
            GROUP BY w.id
            ORDER BY w.id
            """;
        Map<Long, Double> balances = new LinkedHashMap<>();
        jdbc.getJdbcTemplate().query(sql, rs -> {
            balances.put(rs.getLong("wallet_id"), rs.getDouble("balance"));
        });
        return balances;
    }

    public boolean hasData() {
        return countRows().values().stream().anyMatch(count -> count > 0);
    }

    public long lastInsertId() {
        Long id = jdbc.getJdbcTemplate().queryForObject("SELECT last_insert_rowid()", Long.class);
        if (id == null) {
            throw new StorageException("No row id returned by " + path);
        }
        return id;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        dataSource.destroy();
        log.debug("Closed SQLite database {}", path);
    }
}
