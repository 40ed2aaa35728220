package org.abstractica.vaultbridge.impl.protocol;

import java.util.Objects;

/**
 * Client's plaintext handshake announcing its identity.
 *
 * <p>Wire format:</p>
 * <pre>
 * {"type": "handshake", "version": 1,
 *  "client": {"clientId": "...", "clientName": "...", "publicKey": "&lt;base64 SPKI&gt;"}}
 * </pre>
 *
 * @param version protocol version (currently 1)
 * @param client  the client's identity
 */
public record Handshake(int version, ClientInfo client) implements BridgeMessage
{
    public static final int PROTOCOL_VERSION = 1;

    public Handshake
    {
        if (version < 1)
        {
            throw new IllegalArgumentException("Version must be positive: " + version);
        }
        Objects.requireNonNull(client, "client");
    }

    @Override
    public MessageType type()
    {
        return MessageType.HANDSHAKE;
    }

    /**
     * Identity the client presents for approval.
     *
     * @param clientId   derived client id
     * @param clientName display name shown to the user
     * @param publicKey  long-term public key, base64 SPKI
     */
    public record ClientInfo(String clientId, String clientName, String publicKey)
    {
        public ClientInfo
        {
            Objects.requireNonNull(clientId, "clientId");
            Objects.requireNonNull(clientName, "clientName");
            Objects.requireNonNull(publicKey, "publicKey");
        }
    }
}
