package ru.fix.distlock.memcached;

import net.spy.memcached.CASResponse;
import net.spy.memcached.CASValue;
import net.spy.memcached.MemcachedClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.fix.distlock.AbstractLocker;
import ru.fix.distlock.LockAcquisitionConflictException;
import ru.fix.distlock.LockConfig;
import ru.fix.distlock.LockConfigurationException;
import ru.fix.distlock.LockException;
import ru.fix.distlock.LockNotHeldException;
import ru.fix.distlock.LockTransportException;

import java.time.Duration;
import java.util.Objects;

/**
 * Lock item created with {@code add}, value is the owner id, expiration is
 * {@link LockConfig#getTimeoutSeconds()}. Renew and release go through {@code gets} followed by
 * a cas-guarded write, so an item replaced by another owner in between is never touched.
 */
public class MemcachedLocker extends AbstractLocker {

    /**
     * Larger expirations are read by memcached as an absolute unix time.
     */
    static final Duration MAX_EXPIRATION = Duration.ofDays(30);

    private final MemcachedClient memcachedClient;
    private final String key;
    private final int expiration;

    public MemcachedLocker(@NotNull MemcachedClient memcachedClient, @NotNull LockConfig config) {
        super(config);
        this.memcachedClient = Objects.requireNonNull(memcachedClient, "memcachedClient");
        this.key = config.getLockName();
        if (config.getTimeoutSeconds() > MAX_EXPIRATION.getSeconds()) {
            throw new LockConfigurationException("Invalid configuration. Memcached expiration should not exceed "
                    + MAX_EXPIRATION + ", got " + config.getTimeout());
        }
        this.expiration = (int) config.getTimeoutSeconds();
    }

    @Override
    protected void doLock(Duration timeout) throws LockException {
        Boolean added = await(memcachedClient.add(key, expiration, config.getOwnerId()), timeout, "add");
        if (Boolean.TRUE.equals(added)) {
            return;
        }

        CASValue<Object> current = gets(timeout);
        if (current != null && config.getOwnerId().equals(current.getValue())) {
            logger.debug("Item {} already holds owner {}, extending", key, current.getValue());
            if (compareAndExtend(current, timeout) == CASResponse.OK) {
                return;
            }
            current = null;
        }
        throw new LockAcquisitionConflictException(config.getLockName(),
                current != null ? String.valueOf(current.getValue()) : null);
    }

    @Override
    protected void doRenew(Duration timeout) throws LockException {
        CASValue<Object> current = gets(timeout);
        if (current == null) {
            throw new LockNotHeldException(config.getLockName(), "Item " + key + " does not exist");
        }
        if (!config.getOwnerId().equals(current.getValue())) {
            throw new LockNotHeldException(config.getLockName(), "Item " + key + " belongs to " + current.getValue());
        }
        CASResponse response = compareAndExtend(current, timeout);
        if (response != CASResponse.OK) {
            throw new LockNotHeldException(config.getLockName(),
                    "Item " + key + " changed during renewal, cas response " + response);
        }
        logger.debug("Item {} expiration extended by {}s", key, expiration);
    }

    @Override
    protected void doUnlock(Duration timeout) throws LockException {
        CASValue<Object> current = gets(timeout);
        if (current == null) {
            logger.debug("Item {} already removed on release", key);
            return;
        }
        if (!config.getOwnerId().equals(current.getValue())) {
            throw new LockNotHeldException(config.getLockName(), "Item " + key + " belongs to " + current.getValue());
        }
        Boolean deleted = await(memcachedClient.delete(key, current.getCas()), timeout, "delete");
        if (!Boolean.TRUE.equals(deleted)) {
            CASValue<Object> after = gets(timeout);
            if (after != null) {
                throw new LockNotHeldException(config.getLockName(),
                        "Item " + key + " changed during release, now belongs to " + after.getValue());
            }
        }
    }

    @Nullable
    private CASValue<Object> gets(Duration timeout) throws LockTransportException {
        return await(memcachedClient.asyncGets(key), timeout, "gets");
    }

    private CASResponse compareAndExtend(CASValue<Object> current, Duration timeout) throws LockTransportException {
        return await(
                memcachedClient.asyncCAS(key, current.getCas(), expiration, current.getValue(),
                        memcachedClient.getTranscoder()),
                timeout,
                "cas");
    }
}
