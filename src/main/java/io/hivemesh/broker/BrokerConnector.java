package io.hivemesh.broker;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.net.URISyntaxException;
import java.util.concurrent.TimeoutException;

@FunctionalInterface
public interface BrokerConnector {
    Connection open() throws IOException, TimeoutException;

    /**
     * Plain amqp-client connector. The client's own recovery is switched off because
     * {@link ConnectionManager} owns the reconnect policy.
     */
    static BrokerConnector amqp(BrokerSettings settings) {
        return () -> {
            ConnectionFactory factory = new ConnectionFactory();
            try {
                factory.setUri(settings.uri());
            } catch (URISyntaxException | GeneralSecurityException e) {
                throw new IllegalArgumentException("Invalid broker uri: " + settings.redactedUri(), e);
            }
            factory.setAutomaticRecoveryEnabled(false);
            factory.setTopologyRecoveryEnabled(false);
            factory.setRequestedHeartbeat(settings.heartbeatSeconds());
            factory.setConnectionTimeout(settings.connectionTimeoutMs());
            return factory.newConnection(settings.connectionName());
        };
    }
}
