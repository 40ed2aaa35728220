package org.abstractica.vaultbridge.impl.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.abstractica.vaultbridge.BridgeClient;
import org.abstractica.vaultbridge.BridgeClientStats;
import org.abstractica.vaultbridge.ConnectionState;
import org.abstractica.vaultbridge.ConnectionStatus;
import org.abstractica.vaultbridge.DecryptionException;
import org.abstractica.vaultbridge.ExtensionTarget;
import org.abstractica.vaultbridge.HandshakeIncompleteException;
import org.abstractica.vaultbridge.NotAuthorizedException;
import org.abstractica.vaultbridge.RetryPolicy;
import org.abstractica.vaultbridge.Subscription;
import org.abstractica.vaultbridge.TransportException;
import org.abstractica.vaultbridge.VaultResponse;
import org.abstractica.vaultbridge.action.VaultAction;
import org.abstractica.vaultbridge.impl.crypto.ClientIdentity;
import org.abstractica.vaultbridge.impl.crypto.EcdhKeyExchange;
import org.abstractica.vaultbridge.impl.crypto.EnvelopeCipher;
import org.abstractica.vaultbridge.impl.crypto.SealedEnvelope;
import org.abstractica.vaultbridge.impl.protocol.AuthorizationUpdate;
import org.abstractica.vaultbridge.impl.protocol.BridgeMessage;
import org.abstractica.vaultbridge.impl.protocol.ErrorMessage;
import org.abstractica.vaultbridge.impl.protocol.Handshake;
import org.abstractica.vaultbridge.impl.protocol.HandshakeResponse;
import org.abstractica.vaultbridge.impl.protocol.MessageCodec;
import org.abstractica.vaultbridge.impl.protocol.Ping;
import org.abstractica.vaultbridge.impl.protocol.Pong;
import org.abstractica.vaultbridge.impl.protocol.Request;
import org.abstractica.vaultbridge.impl.protocol.Response;
import org.abstractica.vaultbridge.impl.transport.Transport;
import org.abstractica.vaultbridge.impl.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Consumer;

/**
 * Default implementation of the BridgeClient interface.
 *
 * <p>Manages the connection to the vault bridge, performs the handshake,
 * tracks pairing and correlates encrypted requests with their responses.</p>
 *
 * <p>All connection state lives on a single scheduler thread. Public methods
 * hand their work to that thread, and transport callbacks are re-dispatched
 * onto it tagged with the connection generation they belong to. Events from
 * an older generation are dropped, so a late close from a previous socket
 * cannot tear down a newer connection.</p>
 */
public class DefaultBridgeClient implements BridgeClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultBridgeClient.class);
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int REQUEST_ID_BYTES = 16;
    private static final long LOOP_WAIT_SECONDS = 5;

    static final String CONNECT_FAILED_ERROR = "Connection failed - is the vault running?";

    private final URI bridgeUri;
    private final String clientName;
    private final ExtensionTarget target;
    private final Duration requestTimeout;
    private final Duration keepaliveInterval;
    private final Transport transport;

    private final ScheduledThreadPoolExecutor loop;
    private volatile Thread loopThread;
    private final CompletableFuture<ClientIdentity> identity;
    private final AuthorizationStateMachine stateMachine;
    private final DefaultBridgeClientStats stats;
    private final PendingRequests pendingRequests;
    private final Retrier retrier;

    // Loop-confined connection state
    private PublicKey serverPublicKey;
    private int generation;
    private CompletableFuture<Void> connecting;
    private ScheduledFuture<?> keepaliveTask;

    private volatile boolean closed;

    /**
     * Creates a new client. Use {@link DefaultBridgeClientFactory} instead.
     *
     * @param identity the identity to use, or null to generate one in the background
     */
    DefaultBridgeClient(
            URI bridgeUri,
            String clientName,
            ExtensionTarget target,
            Duration requestTimeout,
            Duration keepaliveInterval,
            Transport transport,
            ClientIdentity identity
    )
    {
        this.bridgeUri = Objects.requireNonNull(bridgeUri, "bridgeUri");
        this.clientName = Objects.requireNonNull(clientName, "clientName");
        this.target = Objects.requireNonNull(target, "target");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.keepaliveInterval = Objects.requireNonNull(keepaliveInterval, "keepaliveInterval");
        this.transport = Objects.requireNonNull(transport, "transport");

        this.loop = new ScheduledThreadPoolExecutor(1, runnable ->
        {
            Thread thread = new Thread(runnable, "vault-bridge-client");
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        this.loop.setRemoveOnCancelPolicy(true);

        this.stateMachine = new AuthorizationStateMachine();
        this.stats = new DefaultBridgeClientStats();
        this.pendingRequests = new PendingRequests(loop, stats);
        this.stats.bindPendingRequests(pendingRequests::size);
        this.retrier = new Retrier(loop);

        this.identity = identity != null
                ? CompletableFuture.completedFuture(identity)
                : CompletableFuture.supplyAsync(ClientIdentity::generate, loop);
        this.identity.whenComplete((id, error) ->
        {
            if (error != null)
            {
                LOG.error("Failed to generate client identity", error);
                return;
            }
            stateMachine.identityReady(id.getClientId());
            LOG.info("Client identity ready: {}", id.getClientId());
        });
    }

    // ========== Connection ==========

    @Override
    public CompletableFuture<Void> connect()
    {
        return onLoop(this::doConnect);
    }

    @Override
    public CompletableFuture<Void> connect(RetryPolicy policy)
    {
        return retrier.retry("connect", policy,
                cause -> cause instanceof TransportException && !closed,
                () -> connect());
    }

    @Override
    public void disconnect()
    {
        runOnLoopAndWait(this::doDisconnect);
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        disconnect();
        closed = true;
        // Delayed retries still run and fail fast against the closed client
        loop.shutdown();
        LOG.info("Client closed");
    }

    private CompletableFuture<Void> doConnect(ClientIdentity id)
    {
        if (transport.isOpen() && stateMachine.current().status() != ConnectionStatus.DISCONNECTED)
        {
            return CompletableFuture.completedFuture(null);
        }
        if (connecting != null)
        {
            return connecting;
        }

        int gen = ++generation;
        serverPublicKey = null;
        stateMachine.connecting();
        LOG.info("Connecting to {}", bridgeUri);

        CompletableFuture<Void> result = new CompletableFuture<>();
        connecting = result;

        CompletableFuture<Void> opened;
        try
        {
            opened = transport.connect(bridgeUri, new ConnectionListener(gen));
        }
        catch (RuntimeException e)
        {
            opened = CompletableFuture.failedFuture(e);
        }

        opened.whenCompleteAsync((ignored, error) -> onOpened(gen, id, result, error), loop);
        return result;
    }

    private void onOpened(int gen, ClientIdentity id, CompletableFuture<Void> result, Throwable error)
    {
        if (connecting == result)
        {
            connecting = null;
        }

        if (gen != generation)
        {
            // Disconnected while the socket was opening
            if (error == null)
            {
                transport.close();
            }
            result.completeExceptionally(new TransportException("Connection attempt cancelled"));
            return;
        }

        if (error != null)
        {
            Throwable cause = Retrier.unwrap(error);
            LOG.warn("Connection to {} failed: {}", bridgeUri, cause.getMessage());
            connectionLost(gen, CONNECT_FAILED_ERROR);
            result.completeExceptionally(cause instanceof TransportException
                    ? cause
                    : new TransportException("Failed to connect to " + bridgeUri, cause));
            return;
        }

        LOG.info("Connected to {}, sending handshake", bridgeUri);
        Handshake handshake = new Handshake(Handshake.PROTOCOL_VERSION,
                new Handshake.ClientInfo(id.getClientId(), clientName, id.getPublicKeyBase64()));
        send(handshake);
        startKeepalive(gen);
        result.complete(null);
    }

    private void doDisconnect()
    {
        generation++;

        if (connecting != null)
        {
            connecting.completeExceptionally(new TransportException("Disconnected"));
            connecting = null;
        }

        stopKeepalive();
        transport.close();
        serverPublicKey = null;

        int failed = pendingRequests.failAll(new TransportException("Connection closed"));
        if (stateMachine.current().status() != ConnectionStatus.DISCONNECTED)
        {
            stateMachine.disconnected(null);
            LOG.info("Disconnected from {} ({} pending requests failed)", bridgeUri, failed);
        }
    }

    private void connectionLost(int gen, String error)
    {
        if (gen != generation || stateMachine.current().status() == ConnectionStatus.DISCONNECTED)
        {
            return;
        }

        stopKeepalive();
        serverPublicKey = null;
        int failed = pendingRequests.failAll(new TransportException("Connection closed"));
        stateMachine.disconnected(error);

        if (error != null)
        {
            LOG.warn("Connection lost: {} ({} pending requests failed)", error, failed);
        }
        else
        {
            LOG.info("Connection closed ({} pending requests failed)", failed);
        }
    }

    // ========== Requests ==========

    @Override
    public CompletableFuture<VaultResponse> sendRequest(VaultAction action)
    {
        return sendRequest(action, requestTimeout);
    }

    @Override
    public CompletableFuture<VaultResponse> sendRequest(VaultAction action, Duration timeout)
    {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero())
        {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        return onLoop(id -> doSendRequest(id, action, timeout));
    }

    @Override
    public CompletableFuture<VaultResponse> sendRequest(VaultAction action, RetryPolicy policy)
    {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(policy, "policy");
        return retrier.retry(action.method(), policy,
                cause -> !(cause instanceof IllegalArgumentException) && !closed,
                () -> sendRequest(action, policy.requestTimeout()));
    }

    private CompletableFuture<VaultResponse> doSendRequest(ClientIdentity id, VaultAction action, Duration timeout)
    {
        if (!transport.isOpen())
        {
            return CompletableFuture.failedFuture(new TransportException("Not connected"));
        }
        if (serverPublicKey == null)
        {
            return CompletableFuture.failedFuture(new HandshakeIncompleteException());
        }
        ConnectionStatus status = stateMachine.current().status();
        if (status != ConnectionStatus.PAIRED)
        {
            return CompletableFuture.failedFuture(new NotAuthorizedException(status));
        }
        try
        {
            action.validate();
        }
        catch (IllegalArgumentException e)
        {
            return CompletableFuture.failedFuture(e);
        }

        String requestId = newRequestId();
        ObjectNode body = MessageCodec.requestBody(action, requestId);
        SealedEnvelope sealed = EnvelopeCipher.seal(MessageCodec.writeBody(body), serverPublicKey);
        Request request = new Request(
                action.method(),
                sealed.ciphertextBase64(),
                sealed.ivBase64(),
                id.getClientId(),
                sealed.senderPublicKeyBase64(),
                target.publicKey(),
                target.name());

        CompletableFuture<VaultResponse> result = new CompletableFuture<>();
        pendingRequests.register(requestId, result, timeout);

        LOG.debug("Sending {} request {} to {}", action.method(), requestId, target.name());
        transport.send(MessageCodec.encode(request)).whenCompleteAsync((ignored, error) ->
        {
            if (error == null)
            {
                stats.recordRequestSent();
                return;
            }
            Throwable cause = Retrier.unwrap(error);
            LOG.warn("Failed to send {} request {}: {}", action.method(), requestId, cause.getMessage());
            pendingRequests.fail(requestId, cause instanceof TransportException
                    ? cause
                    : new TransportException("Send failed", cause));
        }, loop);

        return result;
    }

    private static String newRequestId()
    {
        byte[] bytes = new byte[REQUEST_ID_BYTES];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    // ========== Authorization ==========

    @Override
    public CompletableFuture<Boolean> waitForAuthorization(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        Subscription subscription = stateMachine.subscribe(state ->
        {
            switch (state.status())
            {
                case PAIRED -> result.complete(true);
                case CONNECTED, DISCONNECTED -> result.complete(false);
                default ->
                {
                }
            }
        });

        ScheduledFuture<?> timer;
        try
        {
            timer = loop.schedule(() -> result.complete(false), timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (RejectedExecutionException e)
        {
            subscription.close();
            result.complete(false);
            return result;
        }

        result.whenComplete((authorized, error) ->
        {
            subscription.close();
            timer.cancel(false);
        });
        return result;
    }

    @Override
    public Subscription onStateChange(Consumer<ConnectionState> listener)
    {
        return stateMachine.subscribe(listener);
    }

    // ========== Inbound ==========

    private void handleMessage(String text)
    {
        BridgeMessage message;
        try
        {
            message = MessageCodec.decode(text);
        }
        catch (IllegalArgumentException e)
        {
            stats.recordDecryptionFailure();
            LOG.warn("Dropping malformed message: {}", e.getMessage());
            return;
        }

        if (message instanceof HandshakeResponse handshakeResponse)
        {
            handleHandshakeResponse(handshakeResponse);
        }
        else if (message instanceof Response response)
        {
            handleResponse(response);
        }
        else if (message instanceof AuthorizationUpdate update)
        {
            handleAuthorizationUpdate(update);
        }
        else if (message instanceof ErrorMessage error)
        {
            handleServerError(error);
        }
        else if (message instanceof Pong)
        {
            LOG.trace("Pong received");
        }
        else
        {
            LOG.warn("Unexpected {} message from bridge", message.type().getWireName());
        }
    }

    private void handleHandshakeResponse(HandshakeResponse response)
    {
        if (stateMachine.current().status() != ConnectionStatus.CONNECTING)
        {
            LOG.warn("Ignoring handshake response outside of handshake");
            return;
        }

        String keyText = response.serverPublicKey();
        PublicKey key = null;
        if (keyText != null)
        {
            try
            {
                key = EcdhKeyExchange.decodePublicKey(Base64.getDecoder().decode(keyText));
            }
            catch (IllegalArgumentException e)
            {
                LOG.warn("Invalid server public key in handshake response: {}", e.getMessage());
                keyText = null;
                stateMachine.recordError("Invalid server public key");
            }
        }
        serverPublicKey = key;

        ConnectionStatus status = stateMachine.applyHandshake(
                response.authorized(), response.pendingApproval(), keyText);
        LOG.info("Handshake complete: {}", status);
    }

    private void handleResponse(Response response)
    {
        ObjectNode body;
        try
        {
            SealedEnvelope sealed = SealedEnvelope.fromBase64(
                    response.message(), response.iv(), response.publicKey());
            body = MessageCodec.readBody(identity.join().open(sealed));
        }
        catch (DecryptionException e)
        {
            stats.recordDecryptionFailure();
            LOG.warn("Failed to decrypt {} response: {}", response.action(), e.getMessage());
            return;
        }

        JsonNode requestIdNode = body.get(MessageCodec.REQUEST_ID_FIELD);
        if (requestIdNode == null || !requestIdNode.isTextual())
        {
            stats.recordStrayResponse();
            LOG.debug("Dropping {} response without request id", response.action());
            return;
        }

        String requestId = requestIdNode.asText();
        if (pendingRequests.complete(requestId, new VaultResponse(requestId, body)))
        {
            stats.recordResponse();
            LOG.debug("Response for request {}", requestId);
        }
        else
        {
            stats.recordStrayResponse();
            LOG.debug("No pending request {} (timed out or unknown)", requestId);
        }
    }

    private void handleAuthorizationUpdate(AuthorizationUpdate update)
    {
        if (stateMachine.applyAuthorizationUpdate(update.authorized()))
        {
            LOG.info(update.authorized() ? "Pairing approved" : "Pairing denied or revoked");
        }
        else
        {
            LOG.debug("Ignoring authorization update in state {}", stateMachine.current().status());
        }
    }

    private void handleServerError(ErrorMessage error)
    {
        stats.recordServerError();
        String text = error.message() != null ? error.message() : error.code();
        LOG.warn("Bridge reported error {}: {}", error.code(), error.message());
        stateMachine.recordError(text != null ? text : "Unknown bridge error");
    }

    // ========== Keepalive ==========

    private void startKeepalive(int gen)
    {
        stopKeepalive();
        if (keepaliveInterval.isZero())
        {
            return;
        }
        long intervalMs = keepaliveInterval.toMillis();
        keepaliveTask = loop.scheduleAtFixedRate(() ->
        {
            if (gen == generation && transport.isOpen())
            {
                send(new Ping());
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void stopKeepalive()
    {
        if (keepaliveTask != null)
        {
            keepaliveTask.cancel(false);
            keepaliveTask = null;
        }
    }

    private void send(BridgeMessage message)
    {
        transport.send(MessageCodec.encode(message)).whenComplete((ignored, error) ->
        {
            if (error != null)
            {
                LOG.warn("Failed to send {}: {}", message.type().getWireName(),
                        Retrier.unwrap(error).getMessage());
            }
        });
    }

    // ========== Loop ==========

    private <T> CompletableFuture<T> onLoop(Function<ClientIdentity, CompletableFuture<T>> task)
    {
        if (closed)
        {
            return CompletableFuture.failedFuture(new TransportException("Client is closed"));
        }
        return identity.thenComposeAsync(task, loop);
    }

    private void runOnLoopAndWait(Runnable task)
    {
        if (Thread.currentThread() == loopThread)
        {
            task.run();
            return;
        }
        try
        {
            loop.submit(task).get(LOOP_WAIT_SECONDS, TimeUnit.SECONDS);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        catch (ExecutionException e)
        {
            LOG.error("Client task failed", e.getCause());
        }
        catch (TimeoutException e)
        {
            LOG.warn("Client task did not finish within {}s", LOOP_WAIT_SECONDS);
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Client loop already stopped");
        }
    }

    private void dispatch(Runnable task)
    {
        try
        {
            loop.execute(task);
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Dropping transport event after close");
        }
    }

    /**
     * Re-dispatches transport callbacks onto the loop, tagged with their generation.
     */
    private final class ConnectionListener implements TransportListener
    {
        private final int gen;

        ConnectionListener(int gen)
        {
            this.gen = gen;
        }

        @Override
        public void onMessage(String message)
        {
            dispatch(() ->
            {
                if (gen != generation)
                {
                    return;
                }
                try
                {
                    handleMessage(message);
                }
                catch (RuntimeException e)
                {
                    LOG.error("Error handling bridge message", e);
                }
            });
        }

        @Override
        public void onClose(int statusCode, String reason)
        {
            dispatch(() ->
            {
                LOG.debug("Transport closed: {} {}", statusCode, reason);
                connectionLost(gen, null);
            });
        }

        @Override
        public void onError(Throwable error)
        {
            dispatch(() -> connectionLost(gen, "Connection error: " + error.getMessage()));
        }
    }

    // ========== Queries ==========

    @Override
    public ConnectionState getState()
    {
        return stateMachine.current();
    }

    @Override
    public String getClientId()
    {
        return identity.join().getClientId();
    }

    @Override
    public String getPublicKey()
    {
        return identity.join().getPublicKeyBase64();
    }

    @Override
    public BridgeClientStats getStats()
    {
        return stats;
    }
}
