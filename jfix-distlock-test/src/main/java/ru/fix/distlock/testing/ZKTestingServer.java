package ru.fix.distlock.testing;

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.curator.test.InstanceSpec;
import org.apache.curator.test.TestingServer;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

import static org.slf4j.LoggerFactory.getLogger;

/**
 * Single instance zookeeper server for lock tests. <br>
 * Node state lives in a temp folder removed during {@link #close()}. <br>
 * Every server gets its own random chroot, so clients of one server never see nodes of another test.
 * <pre>{@code
 *   ZKTestingServer server = new ZKTestingServer()
 *              .withCloseOnJvmShutdown(true)
 *              .start();
 *   ZookeeperLocker locker = new ZookeeperLocker(server.getClient(), config);
 * }
 * </pre>
 */
public class ZKTestingServer implements AutoCloseable {

    private static final Logger logger = getLogger(ZKTestingServer.class);
    private static final int START_ATTEMPTS = 15;

    private TestingServer zkServer;
    private Path tmpDir;
    private String chroot;
    private CuratorFramework curatorFramework;

    private boolean closeOnJvmShutdown = false;

    /**
     * Register shutdown hook {@link Runtime#addShutdownHook(Thread)} and close on jvm exit.
     */
    public ZKTestingServer withCloseOnJvmShutdown(boolean closeOnJvmShutdown) {
        this.closeOnJvmShutdown = closeOnJvmShutdown;
        return this;
    }

    public ZKTestingServer start() throws Exception {
        tmpDir = Files.createTempDirectory("distlock-zk");
        Exception lastFailure = null;
        for (int i = 0; i < START_ATTEMPTS && zkServer == null; i++) {
            try {
                InstanceSpec instanceSpec = new InstanceSpec(tmpDir.toFile(), InstanceSpec.getRandomPort(),
                        InstanceSpec.getRandomPort(), InstanceSpec.getRandomPort(), true, 1);
                zkServer = new TestingServer(instanceSpec, true);
            } catch (Exception e) {
                logger.debug("Failed to start zk testing server, attempt {}", i + 1, e);
                lastFailure = e;
            }
        }
        if (zkServer == null) {
            throw new IllegalStateException("Failed to start zk testing server", lastFailure);
        }
        if (closeOnJvmShutdown) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::close));
        }

        chroot = UUID.randomUUID().toString();
        try (CuratorFramework client = createClient(zkServer.getConnectString(), 60_000, 15_000)) {
            client.create().forPath("/" + chroot);
        }
        curatorFramework = createClient();
        return this;
    }

    public int getPort() {
        return zkServer.getPort();
    }

    public TestingServer getZkServer() {
        return zkServer;
    }

    /**
     * Creates new client inside this server's chroot. Users should manually close this client.
     */
    public CuratorFramework createClient() {
        return createClient(60_000, 15_000);
    }

    /**
     * Short session timeouts let tests observe ephemeral node removal after a client is gone.
     */
    public CuratorFramework createClient(int sessionTimeoutMs, int connectionTimeoutMs) {
        return createClient(zkServer.getConnectString() + "/" + chroot, sessionTimeoutMs, connectionTimeoutMs);
    }

    private CuratorFramework createClient(String connectionString, int sessionTimeoutMs, int connectionTimeoutMs) {
        CuratorFramework newClient = CuratorFrameworkFactory.builder()
                .connectString(connectionString)
                .retryPolicy(new ExponentialBackoffRetry(1000, 10))
                .sessionTimeoutMs(sessionTimeoutMs)
                .connectionTimeoutMs(connectionTimeoutMs)
                .build();
        newClient.start();
        return newClient;
    }

    /**
     * Managed client for this server, closed together with the server.
     */
    public CuratorFramework getClient() {
        return curatorFramework;
    }

    /**
     * Close server and remove temp directory
     */
    @Override
    public synchronized void close() {
        if (curatorFramework != null) {
            curatorFramework.close();
            curatorFramework = null;
        }
        if (zkServer != null) {
            try {
                zkServer.close();
            } catch (Exception e) {
                logger.error("Failed to close zk testing server", e);
            }
            zkServer = null;
        }
        if (tmpDir != null) {
            try (Stream<Path> files = Files.walk(tmpDir)) {
                files.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
            } catch (IOException e) {
                logger.error("Failed to delete {}", tmpDir, e);
            }
            tmpDir = null;
        }
    }
}
