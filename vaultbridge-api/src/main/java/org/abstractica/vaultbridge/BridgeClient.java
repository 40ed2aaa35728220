package org.abstractica.vaultbridge;

import org.abstractica.vaultbridge.action.VaultAction;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A client that pairs with a local vault over its bridge and exchanges
 * encrypted requests with it.
 *
 * <p>The client owns a long-term P-256 identity. On connect it sends a
 * plaintext handshake with its client id and public key; the vault answers
 * with its own public key and an authorization verdict. Once the user has
 * approved the client ({@link ConnectionStatus#PAIRED}), each request is
 * encrypted with AES-256-GCM under a key agreed between a fresh ephemeral
 * key pair and the vault's key.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * BridgeClient client = clientFactory.builder()
 *     .bridgeUri(URI.create("ws://localhost:19455"))
 *     .clientName("Browser")
 *     .target(new ExtensionTarget(extensionKey, "haex-pass"))
 *     .build();
 *
 * client.onStateChange(state -> System.out.println(state.status()));
 * client.connect().join();
 *
 * if (client.waitForAuthorization(Duration.ofMinutes(1)).join())
 * {
 *     VaultResponse response = client.sendRequest(new VaultAction.GetItems("https://example.com")).join();
 * }
 * }</pre>
 *
 * <p>All futures are completed on the client's own event thread. Callbacks
 * must not block.</p>
 */
public interface BridgeClient extends AutoCloseable
{
    /**
     * Opens the transport and sends the handshake.
     *
     * <p>Returns immediately if the transport is already open. The future
     * completes once the transport is open and the handshake has been sent;
     * the verdict arrives later as a state change.</p>
     *
     * @return future completed when connected, or failed with {@link TransportException}
     */
    CompletableFuture<Void> connect();

    /**
     * Connects, retrying on {@link TransportException} according to the policy.
     *
     * @param policy the retry schedule
     * @return future completed when connected, or failed with the last error
     */
    CompletableFuture<Void> connect(RetryPolicy policy);

    /**
     * Closes the transport. Outstanding requests fail with {@link TransportException}
     * and the state returns to {@link ConnectionStatus#DISCONNECTED}.
     */
    void disconnect();

    /**
     * Disconnects and releases the client's event thread. The client cannot be reused.
     */
    @Override
    void close();

    /**
     * Sends an encrypted request using the configured default timeout.
     *
     * @param action the action to perform
     * @return future of the decrypted response
     */
    CompletableFuture<VaultResponse> sendRequest(VaultAction action);

    /**
     * Sends an encrypted request.
     *
     * <p>The future fails with {@link TransportException} if the transport is
     * not open, {@link HandshakeIncompleteException} if no peer key is known,
     * {@link NotAuthorizedException} if the client is not paired,
     * {@link IllegalArgumentException} if the action is invalid, and
     * {@link RequestTimeoutException} if no response arrives in time.</p>
     *
     * @param action  the action to perform
     * @param timeout how long to wait for the response
     * @return future of the decrypted response
     */
    CompletableFuture<VaultResponse> sendRequest(VaultAction action, Duration timeout);

    /**
     * Sends a request, re-issuing it with a fresh request id and ephemeral key
     * after each failure.
     *
     * @param action the action to perform
     * @param policy the retry schedule
     * @return future of the first successful response, or failed with the last error
     */
    CompletableFuture<VaultResponse> sendRequest(VaultAction action, RetryPolicy policy);

    /**
     * Waits until the client is paired.
     *
     * @param timeout maximum time to wait
     * @return future of true once paired; false if denied, disconnected, or timed out
     */
    CompletableFuture<Boolean> waitForAuthorization(Duration timeout);

    /**
     * Registers a state listener.
     *
     * <p>The listener is called once immediately with the current state, then
     * after every state change.</p>
     *
     * @param listener the listener
     * @return subscription that unregisters the listener when closed
     */
    Subscription onStateChange(Consumer<ConnectionState> listener);

    /**
     * Returns the current state.
     *
     * @return state snapshot
     */
    ConnectionState getState();

    /**
     * Returns the client id derived from the long-term public key.
     *
     * <p>Blocks until the identity has been generated.</p>
     *
     * @return 32 lowercase hex characters
     */
    String getClientId();

    /**
     * Returns the long-term public key as base64 SPKI.
     *
     * <p>Blocks until the identity has been generated.</p>
     *
     * @return the public key
     */
    String getPublicKey();

    /**
     * Returns client statistics.
     *
     * @return live statistics
     */
    BridgeClientStats getStats();
}
