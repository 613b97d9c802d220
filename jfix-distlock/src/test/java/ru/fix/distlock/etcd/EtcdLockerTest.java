package ru.fix.distlock.etcd;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.Txn;
import io.etcd.jetcd.common.exception.ErrorCode;
import io.etcd.jetcd.common.exception.EtcdExceptionFactory;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.lease.LeaseGrantResponse;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.etcd.jetcd.lease.LeaseRevokeResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import ru.fix.distlock.LockAcquisitionConflictException;
import ru.fix.distlock.LockConfig;
import ru.fix.distlock.LockNotHeldException;
import ru.fix.distlock.LockState;
import ru.fix.distlock.LockTransportException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class EtcdLockerTest {

    private static final long GRANTED_LEASE = 100L;
    private static final ByteSequence KEY = bytes("job");

    @Mock
    private KV kvClient;
    @Mock
    private Lease leaseClient;

    private Txn txn;
    private EtcdLocker locker;

    @BeforeEach
    public void createLocker() {
        txn = mock(Txn.class, RETURNS_SELF);
        when(kvClient.txn()).thenReturn(txn);

        LeaseGrantResponse grant = mock(LeaseGrantResponse.class);
        when(grant.getID()).thenReturn(GRANTED_LEASE);
        when(leaseClient.grant(2L)).thenReturn(CompletableFuture.completedFuture(grant));
        LeaseRevokeResponse revoked = mock(LeaseRevokeResponse.class);
        when(leaseClient.revoke(anyLong())).thenReturn(CompletableFuture.completedFuture(revoked));

        locker = new EtcdLocker(kvClient, leaseClient, LockConfig.builder()
                .lockName("job")
                .ownerId("owner-a")
                .timeout(Duration.ofMillis(1200))
                .renewalInterval(Duration.ofHours(1))
                .build());
    }

    @AfterEach
    public void closeLocker() {
        locker.close();
    }

    @Test
    public void lockPutsKeyBoundToGrantedLease() throws Exception {
        TxnResponse succeeded = txnResponse(true, null);
        when(txn.commit()).thenReturn(CompletableFuture.completedFuture(succeeded));

        locker.lock();

        assertEquals(LockState.HELD, locker.getState());
        assertEquals(GRANTED_LEASE, locker.getLeaseId());
        verify(leaseClient, never()).revoke(anyLong());
    }

    @Test
    public void lockOfKeyHeldByAnotherOwnerIsConflictAndRevokesNewLease() {
        TxnResponse failed = txnResponse(false, keyValue("owner-b", 55L));
        when(txn.commit()).thenReturn(CompletableFuture.completedFuture(failed));

        LockAcquisitionConflictException e = assertThrows(LockAcquisitionConflictException.class, locker::lock);

        assertEquals("owner-b", e.getCurrentOwner());
        assertEquals(LockState.IDLE, locker.getState());
        verify(leaseClient).revoke(GRANTED_LEASE);
    }

    @Test
    public void lockOfKeyHeldBySameOwnerAdoptsItsLease() throws Exception {
        TxnResponse failed = txnResponse(false, keyValue("owner-a", 42L));
        when(txn.commit()).thenReturn(CompletableFuture.completedFuture(failed));

        locker.lock();

        assertEquals(LockState.HELD, locker.getState());
        assertEquals(42L, locker.getLeaseId());
        verify(leaseClient).revoke(GRANTED_LEASE);
    }

    @Test
    public void renewKeepsOwnLeaseAlive() throws Exception {
        lockSuccessfully();
        GetResponse current = getResponse(keyValue("owner-a", GRANTED_LEASE));
        when(kvClient.get(KEY)).thenReturn(CompletableFuture.completedFuture(current));
        LeaseKeepAliveResponse keepAlive = mock(LeaseKeepAliveResponse.class);
        when(keepAlive.getTTL()).thenReturn(2L);
        when(leaseClient.keepAliveOnce(GRANTED_LEASE)).thenReturn(CompletableFuture.completedFuture(keepAlive));

        locker.renew();

        verify(leaseClient).keepAliveOnce(GRANTED_LEASE);
    }

    @Test
    public void renewFailsWhenKeyIsBoundToAnotherLease() throws Exception {
        lockSuccessfully();
        GetResponse current = getResponse(keyValue("owner-b", 77L));
        when(kvClient.get(KEY)).thenReturn(CompletableFuture.completedFuture(current));

        assertThrows(LockNotHeldException.class, locker::renew);
        verify(leaseClient, never()).keepAliveOnce(anyLong());
    }

    @Test
    public void renewFailsWhenLeaseExpired() throws Exception {
        lockSuccessfully();
        GetResponse current = getResponse(keyValue("owner-a", GRANTED_LEASE));
        when(kvClient.get(KEY)).thenReturn(CompletableFuture.completedFuture(current));
        LeaseKeepAliveResponse keepAlive = mock(LeaseKeepAliveResponse.class);
        when(keepAlive.getTTL()).thenReturn(-1L);
        when(leaseClient.keepAliveOnce(GRANTED_LEASE)).thenReturn(CompletableFuture.completedFuture(keepAlive));

        assertThrows(LockNotHeldException.class, locker::renew);
    }

    @Test
    public void renewFailsWhenLeaseDisappearsBeforeKeepAlive() throws Exception {
        lockSuccessfully();
        GetResponse current = getResponse(keyValue("owner-a", GRANTED_LEASE));
        when(kvClient.get(KEY)).thenReturn(CompletableFuture.completedFuture(current));
        when(leaseClient.keepAliveOnce(GRANTED_LEASE)).thenReturn(CompletableFuture.failedFuture(
                EtcdExceptionFactory.newEtcdException(ErrorCode.NOT_FOUND, "etcdserver: requested lease not found")));

        assertThrows(LockNotHeldException.class, locker::renew);
        assertEquals(LockState.HELD, locker.getState());
    }

    @Test
    public void renewReportsUnavailableServerAsTransportFailure() throws Exception {
        lockSuccessfully();
        GetResponse current = getResponse(keyValue("owner-a", GRANTED_LEASE));
        when(kvClient.get(KEY)).thenReturn(CompletableFuture.completedFuture(current));
        when(leaseClient.keepAliveOnce(GRANTED_LEASE)).thenReturn(CompletableFuture.failedFuture(
                EtcdExceptionFactory.newEtcdException(ErrorCode.UNAVAILABLE, "connection refused")));

        assertThrows(LockTransportException.class, locker::renew);
    }

    @Test
    public void unlockDeletesOwnKeyAndRevokesLease() throws Exception {
        TxnResponse succeeded = txnResponse(true, null);
        when(txn.commit()).thenReturn(CompletableFuture.completedFuture(succeeded));
        locker.lock();

        locker.unlock();

        assertEquals(LockState.RELEASED, locker.getState());
        verify(leaseClient).revoke(GRANTED_LEASE);
    }

    @Test
    public void unlockOfKeyOwnedByAnotherOwnerFails() throws Exception {
        TxnResponse succeeded = txnResponse(true, null);
        TxnResponse foreign = txnResponse(false, keyValue("owner-b", 77L));
        when(txn.commit())
                .thenReturn(CompletableFuture.completedFuture(succeeded))
                .thenReturn(CompletableFuture.completedFuture(foreign));
        locker.lock();

        assertThrows(LockNotHeldException.class, locker::unlock);

        assertEquals(LockState.RELEASED, locker.getState());
        verify(leaseClient, never()).revoke(anyLong());
    }

    @Test
    public void failedLeaseGrantIsTransportFailure() {
        when(leaseClient.grant(2L)).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("unavailable")));

        assertThrows(LockTransportException.class, locker::lock);
        assertEquals(LockState.IDLE, locker.getState());
    }

    private void lockSuccessfully() throws Exception {
        TxnResponse succeeded = txnResponse(true, null);
        when(txn.commit()).thenReturn(CompletableFuture.completedFuture(succeeded));
        locker.lock();
    }

    private static TxnResponse txnResponse(boolean succeeded, KeyValue current) {
        List<GetResponse> getResponses = current == null ? List.of() : List.of(getResponse(current));
        TxnResponse response = mock(TxnResponse.class);
        when(response.isSucceeded()).thenReturn(succeeded);
        when(response.getGetResponses()).thenReturn(getResponses);
        return response;
    }

    private static GetResponse getResponse(KeyValue keyValue) {
        GetResponse response = mock(GetResponse.class);
        when(response.getKvs()).thenReturn(List.of(keyValue));
        return response;
    }

    private static KeyValue keyValue(String owner, long lease) {
        KeyValue keyValue = mock(KeyValue.class);
        when(keyValue.getValue()).thenReturn(bytes(owner));
        when(keyValue.getLease()).thenReturn(lease);
        return keyValue;
    }

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, StandardCharsets.UTF_8);
    }
}
