package com.jobgrid.internal;

import com.jobgrid.config.JobGridProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned {@code jobgrid/migration/V*__*.sql} scripts that have not run yet,
 * rewriting table and index names when a table prefix is configured.
 * <p>
 * All pending scripts run in one transaction. On PostgreSQL that transaction holds an advisory
 * lock so concurrently starting nodes migrate one after the other.
 */
@Component
@ConditionalOnProperty(prefix = "jobgrid.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class JobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);

    static final String MIGRATION_RESOURCE_PATTERN = "classpath*:jobgrid/migration/V*__*.sql";
    private static final Pattern MIGRATION_FILE = Pattern.compile("V(\\d+)__(\\w+)\\.sql");
    private static final Pattern PREFIXED_NAME = Pattern.compile("\\b(idx_jobgrid_|uq_jobgrid_|jobgrid_)");
    private static final Pattern SAFE_PREFIX = Pattern.compile("[A-Za-z0-9_]*");
    private static final long MIGRATION_LOCK_KEY = 5_170_411_239_063_221_877L;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public JobSchemaInitializer(DataSource dataSource, Environment environment) {
        JobGridProperties.Database database = Binder.get(environment)
                .bind("jobgrid", JobGridProperties.class)
                .orElseGet(JobGridProperties::new)
                .getDatabase();
        String prefix = database.getTablePrefix() == null ? "" : database.getTablePrefix().trim();
        if (!SAFE_PREFIX.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Unsupported JobGrid table-prefix: " + prefix);
        }
        this.tablePrefix = prefix;
        this.failOnMigrationError = database.isFailOnMigrationError();
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    @Override
    public void afterPropertiesSet() {
        try {
            Integer applied = transactionTemplate.execute(status -> migrate());
            if (applied == null || applied == 0) {
                log.info("JobGrid schema is up to date");
            } else {
                log.info("Applied {} JobGrid migration(s)", applied);
            }
        } catch (RuntimeException e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Failed to migrate the JobGrid schema", e);
            }
            log.error("Failed to migrate the JobGrid schema, continuing because "
                    + "jobgrid.database.fail-on-migration-error=false", e);
        }
    }

    private int migrate() {
        if (isPostgres()) {
            jdbcTemplate.execute("SELECT pg_advisory_xact_lock(" + MIGRATION_LOCK_KEY + ")");
        }
        String historyTable = tablePrefix + "jobgrid_schema_migrations";
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s (
                    version INTEGER PRIMARY KEY,
                    description VARCHAR(255) NOT NULL,
                    checksum VARCHAR(64) NOT NULL,
                    installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP
                )
                """.formatted(historyTable));

        Map<Integer, String> appliedChecksums = new HashMap<>();
        jdbcTemplate.query("SELECT version, checksum FROM " + historyTable, (RowCallbackHandler) rs ->
                appliedChecksums.put(rs.getInt("version"), rs.getString("checksum")));

        Map<Integer, Migration> migrations = loadMigrations();
        if (migrations.isEmpty()) {
            throw new IllegalStateException("No JobGrid migrations found at " + MIGRATION_RESOURCE_PATTERN);
        }
        for (Integer version : appliedChecksums.keySet()) {
            if (!migrations.containsKey(version)) {
                throw new IllegalStateException("Migration V" + version + " is recorded in " + historyTable
                        + " but missing from the classpath");
            }
        }

        int applied = 0;
        for (Migration migration : migrations.values()) {
            String checksum = appliedChecksums.get(migration.version());
            if (checksum != null) {
                if (!checksum.equals(migration.checksum())) {
                    throw new IllegalStateException(migration.fileName() + " changed after it was applied");
                }
                continue;
            }
            Resource script = new ByteArrayResource(
                    renderMigrationSql(migration.sql(), tablePrefix).getBytes(StandardCharsets.UTF_8),
                    migration.fileName());
            jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
                ScriptUtils.executeSqlScript(connection, script);
                return null;
            });
            jdbcTemplate.update("INSERT INTO " + historyTable + " (version, description, checksum) VALUES (?, ?, ?)",
                    migration.version(), migration.description(), migration.checksum());
            log.info("Applied JobGrid migration {}", migration.fileName());
            applied++;
        }
        return applied;
    }

    private Map<Integer, Migration> loadMigrations() {
        Map<Integer, Migration> migrations = new TreeMap<>();
        try {
            for (Resource resource : new PathMatchingResourcePatternResolver().getResources(MIGRATION_RESOURCE_PATTERN)) {
                String fileName = resource.getFilename();
                Matcher matcher = MIGRATION_FILE.matcher(fileName == null ? "" : fileName);
                if (!matcher.matches()) {
                    throw new IllegalStateException("Invalid JobGrid migration file name '" + fileName
                            + "', expected V{version}__{description}.sql");
                }
                String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
                Migration migration = new Migration(Integer.parseInt(matcher.group(1)),
                        matcher.group(2).replace('_', ' '), fileName, sql, sha256(sql));
                Migration duplicate = migrations.putIfAbsent(migration.version(), migration);
                if (duplicate != null) {
                    throw new IllegalStateException("Migration version V" + migration.version() + " is used by both "
                            + duplicate.fileName() + " and " + fileName);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JobGrid migrations", e);
        }
        return migrations;
    }

    private boolean isPostgres() {
        String product = jdbcTemplate.execute(
                (ConnectionCallback<String>) connection -> connection.getMetaData().getDatabaseProductName());
        return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    /**
     * Prefixes every {@code jobgrid_} table, {@code idx_jobgrid_} index and {@code uq_jobgrid_} constraint name.
     */
    static String renderMigrationSql(String sql, String tablePrefix) {
        if (tablePrefix == null || tablePrefix.isEmpty()) {
            return sql;
        }
        return PREFIXED_NAME.matcher(sql).replaceAll(Matcher.quoteReplacement(tablePrefix) + "$1");
    }

    private static String sha256(String sql) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(sql.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private record Migration(int version, String description, String fileName, String sql, String checksum) {
    }
}
