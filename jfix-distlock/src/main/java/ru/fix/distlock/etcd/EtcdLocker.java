package ru.fix.distlock.etcd;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.common.exception.ErrorCode;
import io.etcd.jetcd.common.exception.EtcdException;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.fix.distlock.AbstractLocker;
import ru.fix.distlock.LockAcquisitionConflictException;
import ru.fix.distlock.LockConfig;
import ru.fix.distlock.LockException;
import ru.fix.distlock.LockNotHeldException;
import ru.fix.distlock.LockTransportException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Lock key bound to an etcd lease of {@link LockConfig#getTimeoutSeconds()} seconds.
 * <p>
 * etcd removes the key itself when the lease is not kept alive in time.
 * A key already holding this owner id is adopted together with its lease.
 */
public class EtcdLocker extends AbstractLocker {

    private static final long NO_LEASE = 0L;

    private final KV kvClient;
    private final Lease leaseClient;
    private final ByteSequence key;
    private final ByteSequence owner;

    private long leaseId = NO_LEASE;

    /**
     * @param client open client, closed by the caller
     */
    public EtcdLocker(@NotNull Client client, @NotNull LockConfig config) {
        this(Objects.requireNonNull(client, "client").getKVClient(), client.getLeaseClient(), config);
    }

    EtcdLocker(@NotNull KV kvClient, @NotNull Lease leaseClient, @NotNull LockConfig config) {
        super(config);
        this.kvClient = Objects.requireNonNull(kvClient, "kvClient");
        this.leaseClient = Objects.requireNonNull(leaseClient, "leaseClient");
        this.key = ByteSequence.from(config.getLockName(), StandardCharsets.UTF_8);
        this.owner = ByteSequence.from(config.getOwnerId(), StandardCharsets.UTF_8);
    }

    @Override
    protected void doLock(Duration timeout) throws LockException {
        long grantedLease = await(leaseClient.grant(config.getTimeoutSeconds()), timeout, "lease grant").getID();

        TxnResponse response;
        try {
            response = await(
                    kvClient.txn()
                            .If(new Cmp(key, Cmp.Op.EQUAL, CmpTarget.version(0)))
                            .Then(Op.put(key, owner, PutOption.builder().withLeaseId(grantedLease).build()))
                            .Else(Op.get(key, GetOption.DEFAULT))
                            .commit(),
                    timeout,
                    "lock");
        } catch (LockTransportException e) {
            revokeQuietly(grantedLease, timeout);
            throw e;
        }

        if (response.isSucceeded()) {
            leaseId = grantedLease;
            return;
        }

        revokeQuietly(grantedLease, timeout);
        KeyValue current = firstKeyValue(response.getGetResponses());
        if (current != null && owner.equals(current.getValue())) {
            logger.debug("Key {} already bound to lease {} of this owner", config.getLockName(), current.getLease());
            leaseId = current.getLease();
            return;
        }
        throw new LockAcquisitionConflictException(config.getLockName(),
                current != null ? current.getValue().toString(StandardCharsets.UTF_8) : null);
    }

    @Override
    protected void doRenew(Duration timeout) throws LockException {
        KeyValue current = firstKeyValue(List.of(await(kvClient.get(key), timeout, "read lock key")));
        if (current == null) {
            throw new LockNotHeldException(config.getLockName(), "Lock key " + config.getLockName() + " does not exist");
        }
        if (!owner.equals(current.getValue()) || current.getLease() != leaseId) {
            throw new LockNotHeldException(config.getLockName(),
                    "Lock key " + config.getLockName() + " is bound to owner "
                            + current.getValue().toString(StandardCharsets.UTF_8) + " lease " + current.getLease());
        }

        LeaseKeepAliveResponse keepAlive;
        try {
            keepAlive = await(leaseClient.keepAliveOnce(leaseId), timeout, "lease keep alive");
        } catch (LockTransportException e) {
            if (isLeaseNotFound(e.getCause())) {
                throw new LockNotHeldException(config.getLockName(), "Lease " + leaseId + " expired before keep alive");
            }
            throw e;
        }
        if (keepAlive.getTTL() <= 0) {
            throw new LockNotHeldException(config.getLockName(), "Lease " + leaseId + " already expired");
        }
        logger.debug("Lease {} kept alive, ttl={}s", leaseId, keepAlive.getTTL());
    }

    private static boolean isLeaseNotFound(@Nullable Throwable cause) {
        return cause instanceof EtcdException && ((EtcdException) cause).getErrorCode() == ErrorCode.NOT_FOUND;
    }

    @Override
    protected void doUnlock(Duration timeout) throws LockException {
        TxnResponse response = await(
                kvClient.txn()
                        .If(new Cmp(key, Cmp.Op.EQUAL, CmpTarget.value(owner)))
                        .Then(Op.delete(key, DeleteOption.DEFAULT))
                        .Else(Op.get(key, GetOption.DEFAULT))
                        .commit(),
                timeout,
                "unlock");

        if (!response.isSucceeded()) {
            KeyValue current = firstKeyValue(response.getGetResponses());
            if (current != null) {
                throw new LockNotHeldException(config.getLockName(),
                        "Lock key " + config.getLockName() + " belongs to "
                                + current.getValue().toString(StandardCharsets.UTF_8));
            }
            logger.debug("Key {} already removed on release", config.getLockName());
        }

        long ownLease = leaseId;
        leaseId = NO_LEASE;
        revokeQuietly(ownLease, timeout);
    }

    long getLeaseId() {
        return leaseId;
    }

    private void revokeQuietly(long lease, Duration timeout) {
        if (lease == NO_LEASE) {
            return;
        }
        try {
            await(leaseClient.revoke(lease), timeout, "lease revoke");
        } catch (LockTransportException e) {
            logger.warn("Failed to revoke lease {} of lockName={}, it will expire by itself",
                    lease, config.getLockName(), e);
        }
    }

    @Nullable
    private static KeyValue firstKeyValue(List<GetResponse> responses) {
        for (GetResponse response : responses) {
            if (response != null && !response.getKvs().isEmpty()) {
                return response.getKvs().get(0);
            }
        }
        return null;
    }
}
