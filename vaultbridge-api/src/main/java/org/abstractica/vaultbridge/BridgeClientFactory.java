package org.abstractica.vaultbridge;

import java.net.URI;
import java.time.Duration;

/**
 * Factory for creating BridgeClient instances.
 *
 * <pre>{@code
 * BridgeClientFactory factory = new DefaultBridgeClientFactory();
 * BridgeClient client = factory.builder()
 *     .bridgeUri(URI.create("ws://localhost:19455"))
 *     .clientName("E2E Test Client")
 *     .target(new ExtensionTarget(extensionKey, "haex-pass"))
 *     .build();
 * }</pre>
 */
public interface BridgeClientFactory
{
    /**
     * Creates a new client builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a BridgeClient.
     */
    interface Builder
    {
        /**
         * Sets the bridge endpoint. Defaults to {@code ws://localhost:19455}.
         *
         * @param uri the WebSocket URI
         * @return this builder
         */
        Builder bridgeUri(URI uri);

        /**
         * Sets the display name shown to the user when approving the client.
         *
         * @param name the client name
         * @return this builder
         */
        Builder clientName(String name);

        /**
         * Sets the extension that requests are routed to. Required.
         *
         * @param target routing metadata
         * @return this builder
         */
        Builder target(ExtensionTarget target);

        /**
         * Sets the timeout used by {@link BridgeClient#sendRequest(org.abstractica.vaultbridge.action.VaultAction)}.
         * Defaults to 10 seconds.
         *
         * @param timeout the timeout
         * @return this builder
         */
        Builder requestTimeout(Duration timeout);

        /**
         * Sets the transport open timeout. Defaults to 10 seconds.
         *
         * @param timeout the timeout
         * @return this builder
         */
        Builder connectTimeout(Duration timeout);

        /**
         * Sets the keepalive ping interval. Defaults to 30 seconds;
         * {@link Duration#ZERO} disables pings.
         *
         * @param interval the interval
         * @return this builder
         */
        Builder keepaliveInterval(Duration interval);

        /**
         * Builds the client. Identity generation starts immediately in the background.
         *
         * @return the configured client
         * @throws IllegalStateException if required parameters are missing
         */
        BridgeClient build();
    }
}
