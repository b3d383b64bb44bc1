package io.mcpstudio.client.connection;

import io.mcpstudio.client.util.LogSanitizer;
import io.mcpstudio.core.exception.McpException;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/// Periodic liveness probe of one connected server.
///
/// Every interval the probe runs once. A successful probe resets the failure counter.
/// The failure handler fires when `maxFailures` probes failed in a row, or at once when
/// a probe reports that the transport is gone. Ticks arriving while a probe is still
/// running are dropped.
///
/// @implNote The tick stream is a Mutiny `Multi.ticks()` subscription held as a
/// {@link Cancellable}. `start` and `stop` are synchronized, probes are not.
final class HeartbeatMonitor {

    private static final Logger LOG = Logger.getLogger(HeartbeatMonitor.class);

    private final String serverId;
    private final Duration interval;
    private final int maxFailures;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private volatile Supplier<Uni<Void>> probe;
    private volatile Consumer<String> onFailed;
    private Cancellable ticks;

    HeartbeatMonitor(String serverId, Duration interval, int maxFailures) {
        this.serverId = Objects.requireNonNull(serverId, "serverId must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.maxFailures = maxFailures;
    }

    /// Starts probing, replacing any previous probe.
    ///
    /// @param probe produces one probe round trip
    /// @param onFailed receives the last failure message once the threshold is reached
    synchronized void start(Supplier<Uni<Void>> probe, Consumer<String> onFailed) {
        stop();
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.onFailed = Objects.requireNonNull(onFailed, "onFailed must not be null");
        consecutiveFailures.set(0);
        ticks =
                Multi.createFrom()
                        .ticks()
                        .startingAfter(interval)
                        .every(interval)
                        .onOverflow()
                        .drop()
                        .onItem()
                        .transformToUniAndConcatenate(tick -> check())
                        .subscribe()
                        .with(
                                tripped -> {},
                                failure ->
                                        LOG.errorv(
                                                failure,
                                                "Heartbeat stream failed for {0}",
                                                LogSanitizer.sanitize(serverId)));
        LOG.debugv("Heartbeat started for {0} every {1}", LogSanitizer.sanitize(serverId), interval);
    }

    /// Stops probing. Safe to call when not running.
    synchronized void stop() {
        if (ticks != null) {
            ticks.cancel();
            ticks = null;
            LOG.debugv("Heartbeat stopped for {0}", LogSanitizer.sanitize(serverId));
        }
        probe = null;
        onFailed = null;
    }

    synchronized boolean isRunning() {
        return ticks != null;
    }

    int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    /// Runs one probe and records its outcome.
    ///
    /// @return Uni emitting true if this probe tripped the failure handler
    Uni<Boolean> check() {
        Supplier<Uni<Void>> current = probe;
        Consumer<String> handler = onFailed;
        if (current == null || handler == null) {
            return Uni.createFrom().item(false);
        }
        return Uni.createFrom()
                .deferred(current::get)
                .onItem()
                .transform(ignored -> record(null, handler))
                .onFailure()
                .recoverWithItem(failure -> record(failure, handler));
    }

    private boolean record(Throwable failure, Consumer<String> handler) {
        if (failure == null) {
            consecutiveFailures.set(0);
            return false;
        }

        int failures = consecutiveFailures.incrementAndGet();
        boolean unrecoverable = failure instanceof McpException mcp && mcp.isUnrecoverable();
        LOG.warnv(
                "Heartbeat probe {0}/{1} failed for {2}: {3}",
                failures,
                maxFailures,
                LogSanitizer.sanitize(serverId),
                LogSanitizer.sanitize(failure.getMessage()));
        if (unrecoverable || failures >= maxFailures) {
            handler.accept(failure.getMessage());
            return true;
        }
        return false;
    }
}
