package org.abstractica.vaultbridge.impl.client;

import org.abstractica.vaultbridge.BridgeClient;
import org.abstractica.vaultbridge.BridgeClientFactory;
import org.abstractica.vaultbridge.ExtensionTarget;
import org.abstractica.vaultbridge.impl.crypto.ClientIdentity;
import org.abstractica.vaultbridge.impl.transport.Transport;
import org.abstractica.vaultbridge.impl.transport.WebSocketTransport;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of BridgeClientFactory.
 */
public class DefaultBridgeClientFactory implements BridgeClientFactory
{
    public static final URI DEFAULT_BRIDGE_URI = URI.create("ws://localhost:19455");
    public static final String DEFAULT_CLIENT_NAME = "Vault Bridge Client";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_KEEPALIVE_INTERVAL = Duration.ofSeconds(30);

    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private URI bridgeUri = DEFAULT_BRIDGE_URI;
        private String clientName = DEFAULT_CLIENT_NAME;
        private ExtensionTarget target;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration keepaliveInterval = DEFAULT_KEEPALIVE_INTERVAL;
        private Transport transport; // Optional custom transport (defaults to WebSocketTransport)
        private ClientIdentity identity; // Optional fixed identity (defaults to a fresh one)

        @Override
        public DefaultBuilder bridgeUri(URI uri)
        {
            Objects.requireNonNull(uri, "uri");
            String scheme = uri.getScheme();
            if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme))
            {
                throw new IllegalArgumentException("Bridge URI must use ws or wss: " + uri);
            }
            this.bridgeUri = uri;
            return this;
        }

        @Override
        public DefaultBuilder clientName(String name)
        {
            Objects.requireNonNull(name, "name");
            if (name.isBlank())
            {
                throw new IllegalArgumentException("Client name must not be blank");
            }
            this.clientName = name;
            return this;
        }

        @Override
        public DefaultBuilder target(ExtensionTarget target)
        {
            this.target = Objects.requireNonNull(target, "target");
            return this;
        }

        @Override
        public DefaultBuilder requestTimeout(Duration timeout)
        {
            this.requestTimeout = requirePositive(timeout, "requestTimeout");
            return this;
        }

        @Override
        public DefaultBuilder connectTimeout(Duration timeout)
        {
            this.connectTimeout = requirePositive(timeout, "connectTimeout");
            return this;
        }

        @Override
        public DefaultBuilder keepaliveInterval(Duration interval)
        {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative())
            {
                throw new IllegalArgumentException("keepaliveInterval must not be negative: " + interval);
            }
            this.keepaliveInterval = interval;
            return this;
        }

        /**
         * Sets the transport carrying the connection.
         *
         * <p>If not set, a {@link WebSocketTransport} using the connect timeout is
         * created. Use {@link org.abstractica.vaultbridge.impl.transport.SimulatedTransport}
         * for testing or local development.</p>
         *
         * @param transport the transport to use
         * @return this builder
         */
        public DefaultBuilder transport(Transport transport)
        {
            this.transport = transport;
            return this;
        }

        /**
         * Sets a fixed client identity instead of generating a new one.
         *
         * @param identity the identity to use
         * @return this builder
         */
        public DefaultBuilder identity(ClientIdentity identity)
        {
            this.identity = identity;
            return this;
        }

        @Override
        public BridgeClient build()
        {
            if (target == null)
            {
                throw new IllegalStateException("Extension target must be specified");
            }

            Transport t = (transport != null) ? transport : new WebSocketTransport(connectTimeout);

            return new DefaultBridgeClient(bridgeUri, clientName, target,
                    requestTimeout, keepaliveInterval, t, identity);
        }

        private static Duration requirePositive(Duration duration, String name)
        {
            Objects.requireNonNull(duration, name);
            if (duration.isNegative() || duration.isZero())
            {
                throw new IllegalArgumentException(name + " must be positive: " + duration);
            }
            return duration;
        }
    }
}
