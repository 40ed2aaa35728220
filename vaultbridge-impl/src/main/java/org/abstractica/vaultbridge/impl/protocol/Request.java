package org.abstractica.vaultbridge.impl.protocol;

import java.util.Objects;

/**
 * Encrypted request envelope.
 *
 * <p>{@code message} is the base64 AES-GCM ciphertext (tag appended) of the
 * JSON request body; {@code publicKey} is the sender's single-use ephemeral
 * key. The extension fields are routing metadata read by the bridge.</p>
 *
 * @param action             action method, e.g. {@code get-items}
 * @param message            base64 ciphertext with tag
 * @param iv                 base64 12-byte IV
 * @param clientId           sender's client id
 * @param publicKey          base64 SPKI ephemeral public key
 * @param extensionPublicKey target extension's public key
 * @param extensionName      target extension's name
 */
public record Request(
        String action,
        String message,
        String iv,
        String clientId,
        String publicKey,
        String extensionPublicKey,
        String extensionName
) implements BridgeMessage
{
    public Request
    {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(iv, "iv");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(publicKey, "publicKey");
    }

    @Override
    public MessageType type()
    {
        return MessageType.REQUEST;
    }
}
