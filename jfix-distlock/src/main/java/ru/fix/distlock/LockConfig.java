package ru.fix.distlock;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;

/**
 * Immutable settings of a single {@link Locker} instance.
 * <pre>
 * LockConfig config = LockConfig.builder()
 *         .lockName("billing-report")
 *         .timeout(Duration.ofSeconds(30))
 *         .logger(LoggerFactory.getLogger(ReportJob.class))
 *         .build();
 * </pre>
 * Every field is optional.
 */
@Getter
@ToString(exclude = {"logger", "clock", "renewalFailedListener"})
public final class LockConfig {

    public static final String DEFAULT_LOCK_NAME = "distributed-lock";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(5);

    private final String lockName;
    /**
     * Lease duration of the backend record.
     */
    private final Duration timeout;
    private final String ownerId;
    private final Logger logger;
    /**
     * Delay between background renewals, {@code timeout / 2} unless set explicitly.
     */
    private final Duration renewalInterval;
    /**
     * Bound of a single backend call made without explicit timeout.
     */
    private final Duration operationTimeout;
    private final Clock clock;
    private final LockRenewalFailedListener renewalFailedListener;

    @Builder(toBuilder = true)
    private LockConfig(
            String lockName,
            Duration timeout,
            String ownerId,
            Logger logger,
            Duration renewalInterval,
            Duration operationTimeout,
            Clock clock,
            LockRenewalFailedListener renewalFailedListener
    ) {
        this.lockName = lockName != null ? lockName : DEFAULT_LOCK_NAME;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.ownerId = ownerId != null ? ownerId : defaultOwnerId();
        this.logger = logger != null ? logger : NOPLogger.NOP_LOGGER;
        this.renewalInterval = renewalInterval != null ? renewalInterval : this.timeout.dividedBy(2);
        this.operationTimeout = operationTimeout != null ? operationTimeout : DEFAULT_OPERATION_TIMEOUT;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.renewalFailedListener = renewalFailedListener != null
                ? renewalFailedListener
                : LockRenewalFailedListener.NO_OP;
        validate();
    }

    public static LockConfig defaults() {
        return builder().build();
    }

    private void validate() {
        if (lockName.isBlank()) {
            throw new LockConfigurationException("Invalid configuration. lockName should not be blank");
        }
        if (ownerId.isBlank()) {
            throw new LockConfigurationException("Invalid configuration. ownerId should not be blank");
        }
        requirePositive(timeout, "timeout");
        requirePositive(renewalInterval, "renewalInterval");
        requirePositive(operationTimeout, "operationTimeout");
        if (renewalInterval.compareTo(timeout) >= 0) {
            logger.warn("Renewal interval {} is not shorter than lock timeout {}, lockName={} may expire between renewals",
                    renewalInterval, timeout, lockName);
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value.isNegative() || value.isZero()) {
            throw new LockConfigurationException("Invalid configuration. " + name + " should be positive, got " + value);
        }
    }

    /**
     * Whole seconds of {@link #getTimeout()}, rounded up, at least one.
     * For stores that accept TTL in seconds only.
     */
    public long getTimeoutSeconds() {
        long seconds = timeout.getSeconds();
        if (timeout.getNano() > 0) {
            seconds++;
        }
        return Math.max(1, seconds);
    }

    static String defaultOwnerId() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }
}
