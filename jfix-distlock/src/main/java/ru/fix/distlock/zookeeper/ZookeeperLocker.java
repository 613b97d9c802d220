package ru.fix.distlock.zookeeper;

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.utils.PathUtils;
import org.apache.curator.utils.ZKPaths;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.data.Stat;
import org.jetbrains.annotations.NotNull;
import ru.fix.distlock.AbstractLocker;
import ru.fix.distlock.LockAcquisitionConflictException;
import ru.fix.distlock.LockConfig;
import ru.fix.distlock.LockConfigurationException;
import ru.fix.distlock.LockException;
import ru.fix.distlock.LockNotHeldException;
import ru.fix.distlock.LockTransportException;
import ru.fix.distlock.utils.Marshaller;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Lock uses an ephemeral zk node {@code <basePath>/<lockName>}.
 * <p>
 * The node lives as long as the Curator session that created it, so liveness follows the
 * connection heartbeat and there is nothing to extend. {@link #renew()} only verifies that
 * the node still exists and belongs to this client's session, which turns the background
 * renewal into a loss-of-lock detector.
 * <p>
 * Re-entrant only within one session: another client with the same owner id gets a conflict.
 */
public class ZookeeperLocker extends AbstractLocker {

    public static final String DEFAULT_BASE_PATH = "/locks";

    private final CuratorFramework curatorFramework;
    private final String nodePath;

    /**
     * @param curatorFramework started client, its lifecycle is managed by the caller
     * @param basePath         parent path of lock nodes, created as container node if needed
     */
    public ZookeeperLocker(
            @NotNull CuratorFramework curatorFramework,
            @NotNull String basePath,
            @NotNull LockConfig config
    ) {
        super(config);
        this.curatorFramework = Objects.requireNonNull(curatorFramework, "curatorFramework");
        try {
            this.nodePath = PathUtils.validatePath(ZKPaths.makePath(basePath, config.getLockName()));
        } catch (IllegalArgumentException e) {
            throw new LockConfigurationException(
                    "Invalid lock path for basePath=" + basePath + " lockName=" + config.getLockName(), e);
        }
    }

    public ZookeeperLocker(@NotNull CuratorFramework curatorFramework, @NotNull LockConfig config) {
        this(curatorFramework, DEFAULT_BASE_PATH, config);
    }

    public String getNodePath() {
        return nodePath;
    }

    @Override
    protected void doLock(Duration timeout) throws LockException {
        awaitConnection(timeout);
        byte[] data = Marshaller.marshallToBytes(
                ZkLockNodeData.forLocalHost(config.getOwnerId(), config.getClock().instant()));
        try {
            curatorFramework.create()
                    .creatingParentContainersIfNeeded()
                    .withMode(CreateMode.EPHEMERAL)
                    .forPath(nodePath, data);
            return;
        } catch (KeeperException.NodeExistsException e) {
            logger.debug("Node {} already exists", nodePath, e);
        } catch (Exception e) {
            throw transportFailure("create lock node", e);
        }

        Stat stat = new Stat();
        ZkLockNodeData current;
        try {
            current = Marshaller.unmarshall(
                    curatorFramework.getData().storingStatIn(stat).forPath(nodePath), ZkLockNodeData.class);
        } catch (KeeperException.NoNodeException e) {
            logger.debug("Node {} was removed by another actor between create and data getting", nodePath, e);
            throw new LockAcquisitionConflictException(config.getLockName(), null);
        } catch (IOException e) {
            logger.warn("Lock node {} holds unreadable data", nodePath, e);
            throw new LockAcquisitionConflictException(config.getLockName(), null);
        } catch (Exception e) {
            throw transportFailure("read lock node", e);
        }

        if (stat.getEphemeralOwner() == sessionId() && config.getOwnerId().equals(current.getOwnerId())) {
            logger.debug("Lock node {} already created by this session", nodePath);
            return;
        }
        throw new LockAcquisitionConflictException(config.getLockName(), current.getOwnerId());
    }

    @Override
    protected void doRenew(Duration timeout) throws LockException {
        awaitConnection(timeout);
        Stat stat;
        try {
            stat = curatorFramework.checkExists().forPath(nodePath);
        } catch (Exception e) {
            throw transportFailure("check lock node", e);
        }
        if (stat == null) {
            throw new LockNotHeldException(config.getLockName(), "Lock node " + nodePath + " does not exist");
        }
        if (stat.getEphemeralOwner() != sessionId()) {
            throw new LockNotHeldException(config.getLockName(),
                    "Lock node " + nodePath + " belongs to session " + Long.toHexString(stat.getEphemeralOwner()));
        }
        logger.debug("Lock node {} is alive, session heartbeat keeps it", nodePath);
    }

    @Override
    protected void doUnlock(Duration timeout) throws LockException {
        awaitConnection(timeout);
        Stat stat = new Stat();
        try {
            curatorFramework.getData().storingStatIn(stat).forPath(nodePath);
        } catch (KeeperException.NoNodeException e) {
            logger.debug("Node {} already removed on release", nodePath, e);
            return;
        } catch (Exception e) {
            throw transportFailure("read lock node", e);
        }

        if (stat.getEphemeralOwner() != sessionId()) {
            throw new LockNotHeldException(config.getLockName(),
                    "Lock node " + nodePath + " belongs to session " + Long.toHexString(stat.getEphemeralOwner()));
        }

        try {
            curatorFramework.delete().withVersion(stat.getVersion()).forPath(nodePath);
        } catch (KeeperException.NoNodeException e) {
            logger.debug("Node {} already released", nodePath, e);
        } catch (KeeperException.BadVersionException e) {
            throw new LockNotHeldException(config.getLockName(), "Lock node " + nodePath + " was modified concurrently");
        } catch (Exception e) {
            throw transportFailure("delete lock node", e);
        }
    }

    private void awaitConnection(Duration timeout) throws LockTransportException {
        try {
            if (!curatorFramework.blockUntilConnected((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()),
                    TimeUnit.MILLISECONDS)) {
                throw new LockTransportException(config.getLockName(),
                        "Not connected to ZooKeeper within " + timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTransportException(config.getLockName(), "Interrupted while connecting to ZooKeeper", e);
        }
    }

    private long sessionId() throws LockTransportException {
        try {
            return curatorFramework.getZookeeperClient().getZooKeeper().getSessionId();
        } catch (Exception e) {
            throw transportFailure("read session id", e);
        }
    }

    private LockTransportException transportFailure(String action, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        return new LockTransportException(config.getLockName(),
                "Failed to " + action + " " + nodePath + ": " + e.getMessage(), e);
    }
}
