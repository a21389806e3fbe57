package com.jobgrid.logging;

import com.jobgrid.config.JobGridProperties;
import com.jobgrid.model.JobLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.regex.Pattern;

/**
 * Writes log entries with plain JDBC in a transaction of their own.
 * With {@code jobgrid.logs.use-primary-store=true} entries join the caller's transaction instead.
 */
public class JdbcJobLogStore implements JobLogStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobLogStore.class);
    private static final Pattern SAFE_TABLE_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String insertSql;

    public JdbcJobLogStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
            JobGridProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(properties.getLogs().isUsePrimaryStore()
                ? TransactionDefinition.PROPAGATION_REQUIRED
                : TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.insertSql = buildInsertSql(resolveTableName(properties.getDatabase().getTablePrefix()));
    }

    @Override
    public void append(JobLogEntry entry) {
        transactionTemplate.executeWithoutResult(status -> jdbcTemplate.update(insertSql, ps -> {
            ps.setObject(1, entry.getId());
            ps.setObject(2, entry.getJobResultId());
            ps.setString(3, entry.getLogLevel().name());
            ps.setString(4, entry.getGrouping());
            ps.setString(5, entry.getMessage());
            ps.setObject(6, entry.getCreated());
            ps.setString(7, entry.getLogObject());
            ps.setString(8, entry.getAbsoluteUrl());
        }));
        log.trace("Stored log entry {} for job result {}", entry.getId(), entry.getJobResultId());
    }

    private String resolveTableName(String tablePrefix) {
        String prefix = tablePrefix == null ? "" : tablePrefix.trim();
        String tableName = prefix + "jobgrid_job_log_entries";
        if (!SAFE_TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Unsupported job log table name: " + tableName);
        }
        return tableName;
    }

    private String buildInsertSql(String tableName) {
        return """
                INSERT INTO %s (id, job_result_id, log_level, grouping, message, created, log_object, absolute_url)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(tableName);
    }
}
