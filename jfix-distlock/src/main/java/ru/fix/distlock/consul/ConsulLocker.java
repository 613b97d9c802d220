package ru.fix.distlock.consul;

import com.ecwid.consul.ConsulException;
import com.ecwid.consul.v1.ConsulClient;
import com.ecwid.consul.v1.OperationException;
import com.ecwid.consul.v1.QueryParams;
import com.ecwid.consul.v1.kv.model.GetValue;
import com.ecwid.consul.v1.kv.model.PutParams;
import com.ecwid.consul.v1.session.model.NewSession;
import com.ecwid.consul.v1.session.model.Session;
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
 * Lock key acquired with a consul session of TTL {@link LockConfig#getTimeout()}.
 * The session is created with behavior {@code delete}, so the key disappears together with the session.
 * <p>
 * Consul's HTTP client has no per-request timeout, calls are bounded by the client's own settings.
 */
public class ConsulLocker extends AbstractLocker {

    static final Duration MIN_SESSION_TTL = Duration.ofSeconds(10);
    static final Duration MAX_SESSION_TTL = Duration.ofSeconds(86400);
    private static final int NOT_FOUND = 404;

    private final ConsulClient consulClient;
    private final String key;

    @Nullable
    private String sessionId;

    public ConsulLocker(@NotNull ConsulClient consulClient, @NotNull LockConfig config) {
        super(config);
        this.consulClient = Objects.requireNonNull(consulClient, "consulClient");
        this.key = config.getLockName();
        if (config.getTimeout().compareTo(MIN_SESSION_TTL) < 0 || config.getTimeout().compareTo(MAX_SESSION_TTL) > 0) {
            throw new LockConfigurationException("Invalid configuration. Consul session TTL should be within "
                    + MIN_SESSION_TTL + " and " + MAX_SESSION_TTL + ", got " + config.getTimeout());
        }
    }

    @Override
    protected void doLock(Duration timeout) throws LockException {
        NewSession newSession = new NewSession();
        newSession.setName("lock-" + config.getLockName());
        newSession.setTtl(config.getTimeoutSeconds() + "s");
        newSession.setBehavior(Session.Behavior.DELETE);
        newSession.setLockDelay(0L);

        String createdSession;
        try {
            createdSession = consulClient.sessionCreate(newSession, QueryParams.DEFAULT).getValue();
        } catch (ConsulException e) {
            throw transportFailure("create session", e);
        }

        PutParams putParams = new PutParams();
        putParams.setAcquireSession(createdSession);
        Boolean acquired;
        try {
            acquired = consulClient.setKVValue(key, config.getOwnerId(), putParams).getValue();
        } catch (ConsulException e) {
            destroyQuietly(createdSession);
            throw transportFailure("acquire key", e);
        }

        if (Boolean.TRUE.equals(acquired)) {
            sessionId = createdSession;
            return;
        }

        destroyQuietly(createdSession);
        String currentOwner = null;
        try {
            GetValue current = consulClient.getKVValue(key).getValue();
            if (current != null) {
                currentOwner = current.getDecodedValue();
            }
        } catch (ConsulException e) {
            logger.debug("Failed to read holder of key {}", key, e);
        }
        throw new LockAcquisitionConflictException(config.getLockName(), currentOwner);
    }

    @Override
    protected void doRenew(Duration timeout) throws LockException {
        String ownSession = requireSession();
        Session renewed;
        try {
            renewed = consulClient.renewSession(ownSession, QueryParams.DEFAULT).getValue();
        } catch (OperationException e) {
            if (e.getStatusCode() == NOT_FOUND) {
                throw new LockNotHeldException(config.getLockName(), "Session " + ownSession + " no longer exists");
            }
            throw transportFailure("renew session", e);
        } catch (ConsulException e) {
            throw transportFailure("renew session", e);
        }
        if (renewed == null) {
            throw new LockNotHeldException(config.getLockName(), "Session " + ownSession + " no longer exists");
        }
        logger.debug("Session {} of key {} renewed", ownSession, key);
    }

    @Override
    protected void doUnlock(Duration timeout) throws LockException {
        String ownSession = requireSession();
        GetValue current;
        try {
            current = consulClient.getKVValue(key).getValue();
        } catch (ConsulException e) {
            throw transportFailure("read key", e);
        }
        if (current != null && current.getSession() != null && !current.getSession().equals(ownSession)) {
            throw new LockNotHeldException(config.getLockName(),
                    "Key " + key + " is held by session " + current.getSession());
        }
        try {
            consulClient.sessionDestroy(ownSession, QueryParams.DEFAULT);
        } catch (ConsulException e) {
            throw transportFailure("destroy session", e);
        }
        sessionId = null;
    }

    @Nullable
    String getSessionId() {
        return sessionId;
    }

    private String requireSession() throws LockNotHeldException {
        String ownSession = sessionId;
        if (ownSession == null) {
            throw new LockNotHeldException(config.getLockName(), "No consul session for key " + key);
        }
        return ownSession;
    }

    private void destroyQuietly(String session) {
        try {
            consulClient.sessionDestroy(session, QueryParams.DEFAULT);
        } catch (ConsulException e) {
            logger.warn("Failed to destroy session {} of lockName={}, it will expire by TTL",
                    session, config.getLockName(), e);
        }
    }

    private LockTransportException transportFailure(String action, ConsulException e) {
        return new LockTransportException(config.getLockName(),
                "Failed to " + action + " of key " + key + ": " + e.getMessage(), e);
    }
}
