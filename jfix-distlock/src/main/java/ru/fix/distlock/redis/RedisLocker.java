package ru.fix.distlock.redis;

import org.jetbrains.annotations.NotNull;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import ru.fix.distlock.AbstractLocker;
import ru.fix.distlock.LockAcquisitionConflictException;
import ru.fix.distlock.LockConfig;
import ru.fix.distlock.LockException;
import ru.fix.distlock.LockNotHeldException;
import ru.fix.distlock.LockTransportException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Lock key written with {@code SET NX PX}, value is the owner id.
 * Renew and release run as Lua scripts so the owner check and the mutation are atomic on the server.
 */
public class RedisLocker extends AbstractLocker {

    static final DefaultRedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
                    "return redis.call('pexpire', KEYS[1], ARGV[2]) " +
                    "else return 0 end",
            Long.class);

    /**
     * 1 deleted, 0 absent, -1 held by another owner.
     */
    static final DefaultRedisScript<Long> UNLOCK_SCRIPT = new DefaultRedisScript<>(
            "local current = redis.call('get', KEYS[1]) " +
                    "if not current then return 0 end " +
                    "if current == ARGV[1] then redis.call('del', KEYS[1]) return 1 end " +
                    "return -1",
            Long.class);

    private static final long OWNED_BY_OTHER = -1L;

    private final StringRedisTemplate redisTemplate;
    private final String key;

    public RedisLocker(@NotNull StringRedisTemplate redisTemplate, @NotNull LockConfig config) {
        super(config);
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.key = config.getLockName();
    }

    @Override
    protected void doLock(Duration timeout) throws LockException {
        Boolean acquired;
        String current;
        try {
            acquired = redisTemplate.opsForValue().setIfAbsent(key, config.getOwnerId(), config.getTimeout());
            if (Boolean.TRUE.equals(acquired)) {
                return;
            }
            current = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw transportFailure("acquire", e);
        }

        if (config.getOwnerId().equals(current)) {
            logger.debug("Key {} already holds owner {}, extending", key, current);
            if (extend()) {
                return;
            }
            current = null;
        }
        throw new LockAcquisitionConflictException(config.getLockName(), current);
    }

    @Override
    protected void doRenew(Duration timeout) throws LockException {
        if (!extend()) {
            throw new LockNotHeldException(config.getLockName(),
                    "Key " + key + " is absent or belongs to another owner");
        }
        logger.debug("Key {} expiry extended by {}", key, config.getTimeout());
    }

    @Override
    protected void doUnlock(Duration timeout) throws LockException {
        Long result;
        try {
            result = redisTemplate.execute(UNLOCK_SCRIPT, List.of(key), config.getOwnerId());
        } catch (DataAccessException e) {
            throw transportFailure("release", e);
        }
        if (result != null && result == OWNED_BY_OTHER) {
            throw new LockNotHeldException(config.getLockName(), "Key " + key + " belongs to another owner");
        }
        if (result == null || result == 0L) {
            logger.debug("Key {} already removed on release", key);
        }
    }

    private boolean extend() throws LockTransportException {
        Long result;
        try {
            result = redisTemplate.execute(RENEW_SCRIPT, List.of(key),
                    config.getOwnerId(), String.valueOf(config.getTimeout().toMillis()));
        } catch (DataAccessException e) {
            throw transportFailure("extend", e);
        }
        return result != null && result == 1L;
    }

    private LockTransportException transportFailure(String action, DataAccessException e) {
        return new LockTransportException(config.getLockName(),
                "Failed to " + action + " redis key " + key + ": " + e.getMessage(), e);
    }
}
