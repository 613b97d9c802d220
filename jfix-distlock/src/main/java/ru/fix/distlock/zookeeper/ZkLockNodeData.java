package ru.fix.distlock.zookeeper;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;

/**
 * Payload of an ephemeral lock node.
 * Ip and hostname are diagnostics only, ownership is decided by ownerId and the node's session.
 */
@Data
public class ZkLockNodeData {
    private static final Logger logger = LoggerFactory.getLogger(ZkLockNodeData.class);

    @JsonProperty
    private final String ownerId;

    @JsonProperty
    private final Instant acquiredAt;

    @JsonProperty
    private String ip = "Unknown ip";

    @JsonProperty
    private String hostname = "Unknown hostname";

    @JsonCreator
    public ZkLockNodeData(
            @JsonProperty("ownerId") String ownerId,
            @JsonProperty("acquiredAt") Instant acquiredAt,
            @JsonProperty("ip") String ip,
            @JsonProperty("hostname") String hostname
    ) {
        this.ownerId = ownerId;
        this.acquiredAt = acquiredAt;
        this.ip = ip;
        this.hostname = hostname;
    }

    static ZkLockNodeData forLocalHost(String ownerId, Instant acquiredAt) {
        ZkLockNodeData data = new ZkLockNodeData(ownerId, acquiredAt, "Unknown ip", "Unknown hostname");
        try {
            InetAddress inetAddr = InetAddress.getLocalHost();
            data.setIp(inetAddr.getHostAddress());
            data.setHostname(inetAddr.getHostName());
        } catch (UnknownHostException e) {
            logger.trace("Local host address of lock owner {} is not resolvable", ownerId, e);
        }
        return data;
    }
}
