package ru.fix.distlock.jdbc;

import org.jetbrains.annotations.NotNull;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import ru.fix.distlock.AbstractLocker;
import ru.fix.distlock.LockAcquisitionConflictException;
import ru.fix.distlock.LockConfig;
import ru.fix.distlock.LockConfigurationException;
import ru.fix.distlock.LockException;
import ru.fix.distlock.LockNotHeldException;
import ru.fix.distlock.LockRecord;
import ru.fix.distlock.LockTransportException;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One row per lock in a table keyed by lock name, see {@code ru/fix/distlock/jdbc/distributed_lock.sql}.
 * <p>
 * Acquisition locks the row with {@code SELECT ... FOR UPDATE} before deciding, so the insert is only
 * attempted when no row exists. A failed insert would abort the whole transaction on PostgreSQL.
 */
public class JdbcLocker extends AbstractLocker {

    public static final String DEFAULT_TABLE_NAME = "distributed_lock";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final JdbcTemplate jdbcTemplate;
    private final PlatformTransactionManager transactionManager;

    private final String selectForUpdateSql;
    private final String insertSql;
    private final String takeOverSql;
    private final String renewSql;
    private final String deleteSql;
    private final String selectOwnerSql;

    public JdbcLocker(@NotNull DataSource dataSource, @NotNull String tableName, @NotNull LockConfig config) {
        super(config);
        Objects.requireNonNull(dataSource, "dataSource");
        if (tableName == null || !IDENTIFIER.matcher(tableName).matches()) {
            throw new LockConfigurationException("Invalid configuration. Table name should be a plain identifier, got "
                    + tableName);
        }
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionManager = new DataSourceTransactionManager(dataSource);

        this.selectForUpdateSql = "SELECT name, owner_id, expired_at FROM " + tableName + " WHERE name = ? FOR UPDATE";
        this.insertSql = "INSERT INTO " + tableName
                + " (name, owner_id, expired_at, created_at, updated_at) VALUES (?, ?, ?, ?, ?)";
        this.takeOverSql = "UPDATE " + tableName
                + " SET owner_id = ?, expired_at = ?, updated_at = ? WHERE name = ?";
        this.renewSql = "UPDATE " + tableName
                + " SET expired_at = ?, updated_at = ? WHERE name = ? AND owner_id = ?";
        this.deleteSql = "DELETE FROM " + tableName + " WHERE name = ? AND owner_id = ?";
        this.selectOwnerSql = "SELECT owner_id FROM " + tableName + " WHERE name = ?";
    }

    public JdbcLocker(@NotNull DataSource dataSource, @NotNull LockConfig config) {
        this(dataSource, DEFAULT_TABLE_NAME, config);
    }

    @Override
    protected void doLock(Duration timeout) throws LockException {
        String holder;
        try {
            holder = transactionTemplate(timeout).execute(status -> acquireInTransaction());
        } catch (DuplicateKeyException e) {
            logger.debug("Row {} inserted concurrently", config.getLockName(), e);
            throw new LockAcquisitionConflictException(config.getLockName(), readOwnerQuietly());
        } catch (DataAccessException | TransactionException e) {
            throw transportFailure("acquire", e);
        }
        if (holder != null) {
            throw new LockAcquisitionConflictException(config.getLockName(), holder);
        }
    }

    /**
     * @return owner of a live row of another owner, {@code null} when the row now belongs to this owner
     */
    private String acquireInTransaction() {
        Instant now = config.getClock().instant();
        Timestamp nowTs = Timestamp.from(now);
        Timestamp expiredAt = Timestamp.from(now.plus(config.getTimeout()));

        List<LockRecord> rows = jdbcTemplate.query(selectForUpdateSql,
                (rs, rowNum) -> new LockRecord(
                        rs.getString("name"),
                        rs.getString("owner_id"),
                        rs.getTimestamp("expired_at").toInstant()),
                config.getLockName());

        if (rows.isEmpty()) {
            jdbcTemplate.update(insertSql, config.getLockName(), config.getOwnerId(), expiredAt, nowTs, nowTs);
            return null;
        }

        LockRecord current = rows.get(0);
        if (current.isOwnedBy(config.getOwnerId())) {
            logger.debug("Row {} already belongs to owner {}, extending", config.getLockName(), config.getOwnerId());
        } else if (current.isExpiredAt(now)) {
            logger.info("Expired lock reclaimed lockName={} previousOwner={} ownerId={}",
                    config.getLockName(), current.getOwnerId(), config.getOwnerId());
        } else {
            return current.getOwnerId();
        }
        jdbcTemplate.update(takeOverSql, config.getOwnerId(), expiredAt, nowTs, config.getLockName());
        return null;
    }

    @Override
    protected void doRenew(Duration timeout) throws LockException {
        Instant now = config.getClock().instant();
        Integer updated;
        try {
            updated = transactionTemplate(timeout).execute(status -> jdbcTemplate.update(renewSql,
                    Timestamp.from(now.plus(config.getTimeout())), Timestamp.from(now),
                    config.getLockName(), config.getOwnerId()));
        } catch (DataAccessException | TransactionException e) {
            throw transportFailure("renew", e);
        }
        if (updated == null || updated == 0) {
            throw new LockNotHeldException(config.getLockName(),
                    "Row " + config.getLockName() + " is absent or belongs to another owner");
        }
    }

    @Override
    protected void doUnlock(Duration timeout) throws LockException {
        List<String> owners;
        try {
            owners = transactionTemplate(timeout).execute(status -> {
                if (jdbcTemplate.update(deleteSql, config.getLockName(), config.getOwnerId()) > 0) {
                    return null;
                }
                return jdbcTemplate.queryForList(selectOwnerSql, String.class, config.getLockName());
            });
        } catch (DataAccessException | TransactionException e) {
            throw transportFailure("release", e);
        }
        if (owners == null) {
            return;
        }
        if (!owners.isEmpty()) {
            throw new LockNotHeldException(config.getLockName(),
                    "Row " + config.getLockName() + " belongs to " + owners.get(0));
        }
        logger.debug("Row {} already removed on release", config.getLockName());
    }

    /**
     * Statements run inside the template get the remaining transaction time as query timeout.
     */
    private TransactionTemplate transactionTemplate(Duration timeout) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        long seconds = Math.max(1, (timeout.toMillis() + 999) / 1000);
        template.setTimeout((int) Math.min(Integer.MAX_VALUE, seconds));
        return template;
    }

    private String readOwnerQuietly() {
        try {
            List<String> owners = jdbcTemplate.queryForList(selectOwnerSql, String.class, config.getLockName());
            return owners.isEmpty() ? null : owners.get(0);
        } catch (DataAccessException e) {
            logger.debug("Failed to read holder of lockName={}", config.getLockName(), e);
            return null;
        }
    }

    private LockTransportException transportFailure(String action, RuntimeException e) {
        return new LockTransportException(config.getLockName(),
                "Failed to " + action + " lock row " + config.getLockName() + ": " + e.getMessage(), e);
    }
}
