package org.abstractica.vaultbridge.impl.integration;

import com.fasterxml.jackson.databind.node.ObjectNode;
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
import org.abstractica.vaultbridge.impl.transport.SimulatedTransport;

import java.security.PublicKey;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Vault side of a {@link SimulatedTransport}: answers handshakes, decrypts
 * requests and encrypts responses back to the client.
 */
public class FakeVault
{
    /**
     * A decrypted request as seen by the vault.
     */
    public record ReceivedRequest(Request envelope, ObjectNode body)
    {
        public String requestId()
        {
            return body.get(MessageCodec.REQUEST_ID_FIELD).asText();
        }

        public String action()
        {
            return envelope.action();
        }
    }

    private final SimulatedTransport transport;
    private final EcdhKeyExchange keys = new EcdhKeyExchange();
    private final BlockingQueue<ReceivedRequest> requests = new LinkedBlockingQueue<>();
    private final BlockingQueue<Handshake> handshakes = new LinkedBlockingQueue<>();
    private final AtomicInteger pings = new AtomicInteger();

    private volatile boolean authorized;
    private volatile boolean pendingApproval;
    private volatile boolean answerHandshakes = true;
    private volatile String serverPublicKeyOverride;
    private volatile Function<ReceivedRequest, ObjectNode> responder;
    private volatile PublicKey clientPublicKey;
    private volatile String clientId;

    public FakeVault(SimulatedTransport transport)
    {
        this.transport = transport;
        transport.setPeer(this::onClientMessage);
    }

    // ========== Configuration ==========

    public FakeVault authorized(boolean authorized)
    {
        this.authorized = authorized;
        return this;
    }

    public FakeVault pendingApproval(boolean pendingApproval)
    {
        this.pendingApproval = pendingApproval;
        return this;
    }

    public FakeVault answerHandshakes(boolean answer)
    {
        this.answerHandshakes = answer;
        return this;
    }

    public FakeVault serverPublicKeyOverride(String key)
    {
        this.serverPublicKeyOverride = key;
        return this;
    }

    /**
     * Answers every request automatically.
     *
     * @param responder builds the response body (without requestId); returning null leaves the request unanswered
     */
    public FakeVault respondWith(Function<ReceivedRequest, ObjectNode> responder)
    {
        this.responder = responder;
        return this;
    }

    /**
     * Answers every request with {@code success: true} and the request body echoed as data.
     */
    public FakeVault echoRequests()
    {
        return respondWith(request ->
        {
            ObjectNode body = MessageCodec.mapper().createObjectNode();
            body.put("success", true);
            body.set("data", request.body().deepCopy());
            return body;
        });
    }

    // ========== Peer actions ==========

    public void approve()
    {
        transport.deliver(MessageCodec.encode(new AuthorizationUpdate(true)));
    }

    public void deny()
    {
        transport.deliver(MessageCodec.encode(new AuthorizationUpdate(false)));
    }

    public void sendError(String code, String message)
    {
        transport.deliver(MessageCodec.encode(new ErrorMessage(code, message)));
    }

    public void sendRaw(String text)
    {
        transport.deliver(text);
    }

    /**
     * Encrypts a response body for the client and delivers it.
     *
     * @param request the request being answered
     * @param body    the body; requestId is added
     */
    public void respond(ReceivedRequest request, ObjectNode body)
    {
        ObjectNode withId = body.deepCopy();
        withId.put(MessageCodec.REQUEST_ID_FIELD, request.requestId());
        transport.deliver(MessageCodec.encode(seal(request.action(), withId)));
    }

    /**
     * Builds an encrypted response envelope for an arbitrary body.
     */
    public Response seal(String action, ObjectNode body)
    {
        SealedEnvelope sealed = EnvelopeCipher.seal(MessageCodec.writeBody(body), clientPublicKey);
        return new Response(action, sealed.ciphertextBase64(), sealed.ivBase64(),
                clientId, sealed.senderPublicKeyBase64());
    }

    public void sendHandshakeResponse(boolean authorized, boolean pendingApproval)
    {
        String key = serverPublicKeyOverride != null
                ? serverPublicKeyOverride
                : Base64.getEncoder().encodeToString(keys.getPublicKey());
        transport.deliver(MessageCodec.encode(new HandshakeResponse(key, authorized, pendingApproval)));
    }

    // ========== Inspection ==========

    public ReceivedRequest takeRequest(Duration timeout) throws InterruptedException
    {
        return requests.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Handshake takeHandshake(Duration timeout) throws InterruptedException
    {
        return handshakes.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int getPingCount()
    {
        return pings.get();
    }

    public String getClientId()
    {
        return clientId;
    }

    // ========== Inbound ==========

    private void onClientMessage(String text)
    {
        BridgeMessage message = MessageCodec.decode(text);
        if (message instanceof Handshake handshake)
        {
            clientId = handshake.client().clientId();
            clientPublicKey = EcdhKeyExchange.decodePublicKey(
                    Base64.getDecoder().decode(handshake.client().publicKey()));
            handshakes.add(handshake);
            if (answerHandshakes)
            {
                sendHandshakeResponse(authorized, pendingApproval);
            }
        }
        else if (message instanceof Request request)
        {
            SealedEnvelope sealed = SealedEnvelope.fromBase64(request.message(), request.iv(), request.publicKey());
            ObjectNode body = MessageCodec.readBody(EnvelopeCipher.open(sealed, keys));
            ReceivedRequest received = new ReceivedRequest(request, body);
            requests.add(received);

            Function<ReceivedRequest, ObjectNode> current = responder;
            ObjectNode answer = current != null ? current.apply(received) : null;
            if (answer != null)
            {
                respond(received, answer);
            }
        }
        else if (message instanceof Ping)
        {
            pings.incrementAndGet();
            transport.deliver(MessageCodec.encode(new Pong()));
        }
    }
}
