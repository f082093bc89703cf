package io.hivemesh.broker;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import io.hivemesh.security.SensitiveDataMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

/**
 * Owns the single broker connection and channel of an agent process.
 *
 * <p>Unexpected closes schedule {@link #reconnect()} with capped exponential backoff
 * (see {@link ReconnectBackoff}). After {@link BrokerSettings#maxReconnectAttempts()}
 * consecutive failures listeners get {@link ConnectionListener#onMaxReconnectReached}
 * once and nothing further is scheduled. {@link #close()} is terminal.
 */
public final class ConnectionManager implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);

    private final BrokerSettings settings;
    private final BrokerConnector connector;
    private final ReconnectScheduler scheduler;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Connection connection;
    private volatile Channel channel;
    private volatile boolean closed;
    private int reconnectAttempts;
    private boolean reconnectPending;
    private boolean gaveUp;

    public ConnectionManager(BrokerSettings settings, BrokerConnector connector, ReconnectScheduler scheduler) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public BrokerSettings settings() {
        return settings;
    }

    /**
     * Opens connection and channel and applies prefetch. Resets the reconnect counter
     * on success.
     */
    public void connect() {
        Connection opened = null;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Connection manager is closed");
            }
            discardCurrent();
            try {
                opened = connector.open();
                Channel openedChannel = opened.createChannel();
                if (openedChannel == null) {
                    throw new IOException("Broker refused to open a channel");
                }
                openedChannel.basicQos(settings.prefetchCount());
                Connection owner = opened;
                opened.addShutdownListener(cause -> onShutdown(owner, cause));
                openedChannel.addShutdownListener(cause -> onChannelShutdown(owner, cause));
                connection = opened;
                channel = openedChannel;
                reconnectAttempts = 0;
                reconnectPending = false;
                gaveUp = false;
            } catch (IOException | TimeoutException | RuntimeException e) {
                closeQuietly(opened);
                BrokerConnectionException failure = e instanceof BrokerConnectionException bce
                        ? bce
                        : new BrokerConnectionException("Failed to connect to " + settings.redactedUri(), e);
                fireError(failure);
                throw failure;
            }
        }
        LOG.info("Connected to {} as {} (prefetch={}, heartbeat={}s)",
                settings.redactedUri(), settings.connectionName(), settings.prefetchCount(), settings.heartbeatSeconds());
        for (ConnectionListener listener : listeners) {
            listener.onConnected();
        }
    }

    /**
     * One scheduled reconnect attempt. A failure schedules the next one.
     */
    public void reconnect() {
        synchronized (this) {
            reconnectPending = false;
            if (closed) {
                return;
            }
        }
        try {
            connect();
        } catch (BrokerConnectionException e) {
            LOG.warn("Reconnect attempt {} failed: {}", reconnectAttempts(), SensitiveDataMasker.maskText(e.getMessage()));
            scheduleReconnect();
        }
    }

    public boolean isHealthy() {
        Connection currentConnection = connection;
        Channel currentChannel = channel;
        return !closed
                && currentConnection != null && currentConnection.isOpen()
                && currentChannel != null && currentChannel.isOpen();
    }

    /**
     * Live channel shared by every publish and consume call.
     */
    public Channel channel() {
        Channel current = channel;
        if (current == null || !current.isOpen()) {
            throw new BrokerConnectionException("No open broker channel");
        }
        return current;
    }

    public synchronized int reconnectAttempts() {
        return reconnectAttempts;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            discardCurrent();
        }
        LOG.info("Broker connection closed");
    }

    private void onShutdown(Connection owner, ShutdownSignalException cause) {
        if (owner != connection || closed || cause.isInitiatedByApplication()) {
            return;
        }
        LOG.warn("Broker connection lost: {}", SensitiveDataMasker.maskText(cause.getMessage()));
        for (ConnectionListener listener : listeners) {
            listener.onDisconnected(cause);
        }
        if (settings.autoReconnect()) {
            scheduleReconnect();
        }
    }

    private void onChannelShutdown(Connection owner, ShutdownSignalException cause) {
        if (owner != connection || closed || cause.isInitiatedByApplication() || cause.isHardError()) {
            // hard errors arrive through the connection listener
            return;
        }
        LOG.warn("Broker channel closed: {}", cause.getMessage());
        fireError(cause);
        for (ConnectionListener listener : listeners) {
            listener.onDisconnected(cause);
        }
        if (settings.autoReconnect()) {
            scheduleReconnect();
        }
    }

    void scheduleReconnect() {
        long delay;
        int attempt;
        synchronized (this) {
            if (closed || reconnectPending || gaveUp) {
                return;
            }
            if (reconnectAttempts >= settings.maxReconnectAttempts()) {
                gaveUp = true;
                attempt = reconnectAttempts;
                delay = -1L;
            } else {
                reconnectAttempts++;
                reconnectPending = true;
                attempt = reconnectAttempts;
                delay = ReconnectBackoff.delayMs(attempt);
            }
        }
        if (delay < 0) {
            LOG.error("Giving up on broker after {} reconnect attempts", attempt);
            for (ConnectionListener listener : listeners) {
                listener.onMaxReconnectReached(attempt);
            }
            return;
        }
        LOG.info("Reconnecting in {} ms (attempt {}/{})", delay, attempt, settings.maxReconnectAttempts());
        scheduler.schedule(this::reconnect, delay);
    }

    private void fireError(Throwable error) {
        for (ConnectionListener listener : listeners) {
            listener.onError(error);
        }
    }

    private void discardCurrent() {
        Channel oldChannel = channel;
        Connection oldConnection = connection;
        channel = null;
        connection = null;
        if (oldChannel != null && oldChannel.isOpen()) {
            try {
                oldChannel.close();
            } catch (IOException | TimeoutException | ShutdownSignalException e) {
                LOG.debug("Ignoring error while closing channel: {}", e.getMessage());
            }
        }
        closeQuietly(oldConnection);
    }

    private static void closeQuietly(Connection target) {
        if (target == null || !target.isOpen()) {
            return;
        }
        try {
            target.close();
        } catch (IOException | ShutdownSignalException e) {
            LOG.debug("Ignoring error while closing connection: {}", e.getMessage());
        }
    }
}
