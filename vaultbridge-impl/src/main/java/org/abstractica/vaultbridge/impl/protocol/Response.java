package org.abstractica.vaultbridge.impl.protocol;

/**
 * Encrypted response envelope.
 *
 * <p>Fields are not validated on construction: a malformed envelope is
 * still decoded so the client can count and drop it.</p>
 *
 * @param action    action method being answered
 * @param message   base64 ciphertext with tag
 * @param iv        base64 12-byte IV
 * @param clientId  client id the response is addressed to
 * @param publicKey base64 SPKI ephemeral public key of the sender
 */
public record Response(
        String action,
        String message,
        String iv,
        String clientId,
        String publicKey
) implements BridgeMessage
{
    @Override
    public MessageType type()
    {
        return MessageType.RESPONSE;
    }
}
